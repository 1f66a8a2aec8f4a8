package com.cmsadmin.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves a ServiceCoord to the network address of its shard.
 *
 * Built once from configuration and never mutated afterwards,
 * so it can be shared between threads without synchronization.
 *
 * Example usage:
 * ServiceRegistry registry = new ServiceRegistry.Builder()
 *     .add("EvaluationService", new ServiceAddress("localhost", 25000))
 *     .add("ResourceService", new ServiceAddress("localhost", 28000))
 *     .add("ResourceService", new ServiceAddress("10.0.0.2", 28000))
 *     .build();
 */
public final class ServiceRegistry {

    // service name -> addresses, index in the list = shard number
    private final Map<String, List<ServiceAddress>> services;

    private ServiceRegistry(Builder builder) {
        Map<String, List<ServiceAddress>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<ServiceAddress>> entry : builder.services.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.services = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns how many shards are configured for a service.
     *
     * @param serviceName name of the service
     * @return number of shards, always >= 1
     * @throws UnknownServiceException if the service has no configured shards
     */
    public int shardCount(String serviceName) throws UnknownServiceException {
        List<ServiceAddress> shards = services.get(serviceName);
        if (shards == null || shards.isEmpty()) {
            throw new UnknownServiceException("Service " + serviceName + " is not configured");
        }
        return shards.size();
    }

    /**
     * Returns the address of a service shard.
     *
     * @param coord service coordinate
     * @return host and port of the shard
     * @throws UnknownServiceException if the service is unknown or the shard is out of range
     */
    public ServiceAddress address(ServiceCoord coord) throws UnknownServiceException {
        int count = shardCount(coord.getName());
        if (coord.getShard() >= count) {
            throw new UnknownServiceException("Service " + coord.getName() + " has " + count
                + " shard(s), shard " + coord.getShard() + " does not exist");
        }
        return services.get(coord.getName()).get(coord.getShard());
    }

    /**
     * Returns the shard count, or 0 when the service is not configured.
     * Convenience for callers that treat a missing service as "no shards".
     */
    public int shardCountOrZero(String serviceName) {
        List<ServiceAddress> shards = services.get(serviceName);
        return shards == null ? 0 : shards.size();
    }

    public Set<String> serviceNames() {
        return services.keySet();
    }

    @Override
    public String toString() {
        return "ServiceRegistry" + services;
    }

    /**
     * Builder for ServiceRegistry. Shards are numbered in insertion order.
     */
    public static class Builder {
        private final Map<String, List<ServiceAddress>> services = new LinkedHashMap<>();

        /**
         * Appends one shard to a service.
         * The first address added for a name is shard 0, the second shard 1, and so on.
         */
        public Builder add(String serviceName, ServiceAddress address) {
            Objects.requireNonNull(serviceName, "serviceName cannot be null");
            Objects.requireNonNull(address, "address cannot be null");
            services.computeIfAbsent(serviceName, name -> new ArrayList<>()).add(address);
            return this;
        }

        public ServiceRegistry build() {
            return new ServiceRegistry(this);
        }
    }
}
