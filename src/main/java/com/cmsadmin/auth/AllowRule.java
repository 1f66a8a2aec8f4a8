package com.cmsadmin.auth;

import com.cmsadmin.service.ServiceCoord;

import java.util.Objects;

/**
 * One entry of the allow-list: a method of a service, on one shard or on every shard.
 */
public final class AllowRule {

    /** Shard value meaning "every shard of the service". */
    public static final int ANY_SHARD = -1;

    private final String service;
    private final int shard;
    private final String method;

    private AllowRule(String service, int shard, String method) {
        this.service = Objects.requireNonNull(service, "service cannot be null");
        this.method = Objects.requireNonNull(method, "method cannot be null");
        this.shard = shard;
    }

    /**
     * Allows a method on one specific shard.
     */
    public static AllowRule onShard(ServiceCoord coord, String method) {
        return new AllowRule(coord.getName(), coord.getShard(), method);
    }

    /**
     * Allows a method on every shard of a service.
     */
    public static AllowRule onAnyShard(String service, String method) {
        return new AllowRule(service, ANY_SHARD, method);
    }

    public String getService() {
        return service;
    }

    public int getShard() {
        return shard;
    }

    public String getMethod() {
        return method;
    }

    public boolean isAnyShard() {
        return shard == ANY_SHARD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllowRule)) {
            return false;
        }
        AllowRule other = (AllowRule) o;
        return shard == other.shard && service.equals(other.service) && method.equals(other.method);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, shard, method);
    }

    @Override
    public String toString() {
        return service + "," + (isAnyShard() ? "*" : String.valueOf(shard)) + "." + method;
    }
}
