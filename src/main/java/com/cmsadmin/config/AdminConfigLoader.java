package com.cmsadmin.config;

import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads AdminConfig from a JSON document.
 *
 * Expected layout:
 * {
 *   "core_services": { "EvaluationService": [["localhost", 25000]], ... },
 *   "rpc_timeout_ms": 10000,
 *   "reconnect_interval_ms": 2000,
 *   "storage_directory": "fs-storage"
 * }
 * Only "core_services" is mandatory.
 */
public final class AdminConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(AdminConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "cms-admin.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private AdminConfigLoader() {
    }

    /**
     * Loads the configuration from a file on disk.
     *
     * @param path JSON configuration file
     * @return parsed configuration
     * @throws IOException if the file cannot be read or is malformed
     */
    public static AdminConfig load(Path path) throws IOException {
        log.info("Loading configuration from {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in);
        }
    }

    /**
     * Loads the configuration bundled on the classpath as {@value #DEFAULT_RESOURCE}.
     *
     * @throws IOException if the resource is missing or malformed
     */
    public static AdminConfig loadDefault() throws IOException {
        InputStream in = AdminConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new IOException("Configuration resource " + DEFAULT_RESOURCE + " not found on classpath");
        }
        log.info("Loading bundled configuration {}", DEFAULT_RESOURCE);
        try (in) {
            return parse(in);
        }
    }

    /**
     * Parses a JSON configuration document.
     *
     * @throws IOException if the document is not valid JSON or misses mandatory fields
     */
    public static AdminConfig parse(InputStream in) throws IOException {
        JsonNode root = MAPPER.readTree(in);
        if (root == null || !root.isObject()) {
            throw new IOException("Configuration must be a JSON object");
        }

        JsonNode services = root.get("core_services");
        if (services == null || !services.isObject()) {
            throw new IOException("Missing \"core_services\" object");
        }

        ServiceRegistry.Builder registry = new ServiceRegistry.Builder();
        Iterator<Map.Entry<String, JsonNode>> fields = services.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> service = fields.next();
            if (!service.getValue().isArray()) {
                throw new IOException("Shards of " + service.getKey() + " must be a list of [host, port]");
            }
            for (JsonNode shard : service.getValue()) {
                registry.add(service.getKey(), parseAddress(service.getKey(), shard));
            }
        }

        AdminConfig.Builder builder = new AdminConfig.Builder().serviceRegistry(registry.build());
        try {
            if (root.hasNonNull("rpc_timeout_ms")) {
                builder.rpcTimeoutMs(root.get("rpc_timeout_ms").asLong());
            }
            if (root.hasNonNull("reconnect_interval_ms")) {
                builder.reconnectIntervalMs(root.get("reconnect_interval_ms").asLong());
            }
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid timing value: " + e.getMessage(), e);
        }
        if (root.hasNonNull("storage_directory")) {
            builder.storageDirectory(Path.of(root.get("storage_directory").asText()));
        }

        AdminConfig config = builder.build();
        log.debug("Configuration loaded: {}", config);
        return config;
    }

    private static ServiceAddress parseAddress(String serviceName, JsonNode shard) throws IOException {
        if (!shard.isArray() || shard.size() != 2 || !shard.get(1).canConvertToInt()) {
            throw new IOException("Invalid shard address for " + serviceName + ": " + shard);
        }
        try {
            return new ServiceAddress(shard.get(0).asText(), shard.get(1).asInt());
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid shard address for " + serviceName + ": " + e.getMessage(), e);
        }
    }
}
