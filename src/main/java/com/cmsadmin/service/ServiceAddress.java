package com.cmsadmin.service;

import java.io.Serializable;
import java.util.Objects;

/**
 * Network endpoint of a service shard: the host and port of its RMI registry.
 */
public final class ServiceAddress implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String host;
    private final int port;

    public ServiceAddress(String host, int port) {
        this.host = Objects.requireNonNull(host, "host cannot be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        this.port = port;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ServiceAddress)) {
            return false;
        }
        ServiceAddress other = (ServiceAddress) o;
        return port == other.port && host.equals(other.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port);
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
