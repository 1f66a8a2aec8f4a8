package com.cmsadmin.service;

import java.io.Serializable;
import java.util.Objects;

/**
 * Logical address of one shard of a named backend service.
 * Immutable value type: two coordinates are equal when name and shard are equal.
 * Serializable because it travels inside every RpcRequest.
 */
public final class ServiceCoord implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String name;
    private final int shard;

    /**
     * @param name service name (e.g. "EvaluationService")
     * @param shard shard index, zero based
     * @throws IllegalArgumentException if name is blank or shard is negative
     */
    public ServiceCoord(String name, int shard) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Service name cannot be empty");
        }
        if (shard < 0) {
            throw new IllegalArgumentException("Shard must be >= 0, got " + shard);
        }
        this.name = name;
        this.shard = shard;
    }

    public String getName() {
        return name;
    }

    public int getShard() {
        return shard;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceCoord)) {
            return false;
        }
        ServiceCoord other = (ServiceCoord) o;
        return shard == other.shard && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, shard);
    }

    @Override
    public String toString() {
        return name + "," + shard;
    }
}
