package com.cmsadmin.config;

import com.cmsadmin.service.ServiceRegistry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Centralized configuration for the admin front end and the services it talks to.
 * Contains the service addressing table plus the RPC timing knobs.
 *
 * Uses Builder pattern for clean, validated construction.
 * Immutable after creation - thread-safe.
 *
 * Example usage:
 * AdminConfig config = new AdminConfig.Builder()
 *     .serviceRegistry(registry)
 *     .rpcTimeoutMs(5000)
 *     .build();
 */
public class AdminConfig {

    public static final long DEFAULT_RPC_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_RECONNECT_INTERVAL_MS = 2_000;
    public static final Path DEFAULT_STORAGE_DIRECTORY = Path.of("fs-storage");

    private final ServiceRegistry serviceRegistry;
    private final long rpcTimeoutMs;
    private final long reconnectIntervalMs;
    private final Path storageDirectory;

    /**
     * Private constructor - use Builder to create instances.
     */
    private AdminConfig(Builder builder) {
        this.serviceRegistry = builder.serviceRegistry;
        this.rpcTimeoutMs = builder.rpcTimeoutMs;
        this.reconnectIntervalMs = builder.reconnectIntervalMs;
        this.storageDirectory = builder.storageDirectory;
    }

    /**
     * Returns the addressing table of every backend service.
     */
    public ServiceRegistry getServiceRegistry() {
        return serviceRegistry;
    }

    /**
     * Returns how long a single RPC may stay unanswered before it is failed.
     */
    public long getRpcTimeoutMs() {
        return rpcTimeoutMs;
    }

    /**
     * Returns the delay between two reconnection attempts of a dropped channel.
     */
    public long getReconnectIntervalMs() {
        return reconnectIntervalMs;
    }

    /**
     * Returns where a FileStorage shard started from this configuration keeps its content.
     */
    public Path getStorageDirectory() {
        return storageDirectory;
    }

    @Override
    public String toString() {
        return "AdminConfig{" +
                "services=" + serviceRegistry.serviceNames() +
                ", rpcTimeoutMs=" + rpcTimeoutMs +
                ", reconnectIntervalMs=" + reconnectIntervalMs +
                ", storageDirectory=" + storageDirectory +
                '}';
    }

    /**
     * Builder for creating AdminConfig instances.
     * Everything except the service registry has a default.
     */
    public static class Builder {
        private ServiceRegistry serviceRegistry = new ServiceRegistry.Builder().build();  // Default: no services
        private long rpcTimeoutMs = DEFAULT_RPC_TIMEOUT_MS;
        private long reconnectIntervalMs = DEFAULT_RECONNECT_INTERVAL_MS;
        private Path storageDirectory = DEFAULT_STORAGE_DIRECTORY;

        public Builder serviceRegistry(ServiceRegistry registry) {
            this.serviceRegistry = Objects.requireNonNull(registry, "serviceRegistry cannot be null");
            return this;
        }

        /**
         * Sets the per-call response timeout.
         * Default: 10 seconds
         */
        public Builder rpcTimeoutMs(long timeoutMs) {
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("rpcTimeoutMs must be positive");
            }
            this.rpcTimeoutMs = timeoutMs;
            return this;
        }

        /**
         * Sets the delay between reconnection attempts.
         * Default: 2 seconds
         */
        public Builder reconnectIntervalMs(long intervalMs) {
            if (intervalMs <= 0) {
                throw new IllegalArgumentException("reconnectIntervalMs must be positive");
            }
            this.reconnectIntervalMs = intervalMs;
            return this;
        }

        public Builder storageDirectory(Path directory) {
            this.storageDirectory = Objects.requireNonNull(directory, "storageDirectory cannot be null");
            return this;
        }

        public AdminConfig build() {
            return new AdminConfig(this);
        }
    }
}
