package com.cmsadmin.storage;

import com.cmsadmin.rmi.RemoteService;
import com.cmsadmin.rmi.RpcReply;
import com.cmsadmin.rmi.RpcRequest;
import com.cmsadmin.rpc.RmiServiceLocator;
import com.cmsadmin.service.ServiceCoord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.rmi.RemoteException;
import java.rmi.registry.LocateRegistry;
import java.rmi.registry.Registry;
import java.rmi.server.UnicastRemoteObject;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

/**
 * One shard of the content-addressed file store.
 *
 * Content is saved in a directory under its SHA-1 digest, so identical content
 * is stored once. The description is kept in a sibling ".desc" file.
 *
 * Methods: put_file(binary_data, description) -> digest,
 *          get_file(digest) -> bytes,
 *          describe(digest) -> description.
 * Application errors (unknown method, missing digest, bad arguments) are
 * returned as error replies; only transport problems raise RemoteException.
 */
public class FileStorageServer implements RemoteService {
    private static final Logger log = LoggerFactory.getLogger(FileStorageServer.class);

    private static final Pattern DIGEST = Pattern.compile("[0-9a-f]{40}");
    private static final String DESCRIPTION_SUFFIX = ".desc";

    private final ServiceCoord coord;
    private final Path directory;
    private Registry registry;  // Each shard has its own RMI registry
    private boolean exported = false;

    /**
     * @param coord the shard this server is (e.g. FileStorage,0)
     * @param directory where content is kept, created if missing
     * @throws IOException if the directory cannot be created
     */
    public FileStorageServer(ServiceCoord coord, Path directory) throws IOException {
        this.coord = coord;
        this.directory = Files.createDirectories(directory);
        log.info("FileStorage {} using directory {}", coord, directory.toAbsolutePath());
    }

    /**
     * Exports this shard over RMI: creates a registry on the port and binds the service name.
     * @param port RMI registry port
     * @throws RemoteException if export or binding fails
     */
    public synchronized void start(int port) throws RemoteException {
        // This prevents "Connection refused" errors when RMI auto-detects wrong IP on multi-NIC systems
        if (System.getProperty("java.rmi.server.hostname") == null) {
            System.setProperty("java.rmi.server.hostname", "localhost");
        }

        UnicastRemoteObject.exportObject(this, 0);
        exported = true;
        this.registry = LocateRegistry.createRegistry(port);
        this.registry.rebind(RmiServiceLocator.bindingName(coord), this);

        log.info("[OK] FileStorage {} listening on port {}", coord, port);
    }

    @Override
    public RpcReply invoke(RpcRequest request) {
        long callId = request.getCallId();
        try {
            switch (request.getMethod()) {
                case FileStorageClient.PUT_FILE:
                    byte[] data = request.argument(FileStorageClient.ARG_DATA, byte[].class);
                    if (data == null) {
                        return RpcReply.failure(callId, "Missing argument " + FileStorageClient.ARG_DATA);
                    }
                    return RpcReply.success(callId,
                        putFile(data, request.argument(FileStorageClient.ARG_DESCRIPTION, String.class)));
                case FileStorageClient.GET_FILE:
                    return RpcReply.success(callId, getFile(request.argument(FileStorageClient.ARG_DIGEST, String.class)));
                case FileStorageClient.DESCRIBE:
                    return RpcReply.success(callId, describe(request.argument(FileStorageClient.ARG_DIGEST, String.class)));
                default:
                    log.warn("Unknown method {} requested", request.getMethod());
                    return RpcReply.failure(callId, "Unknown method " + request.getMethod());
            }
        } catch (NoSuchFileException e) {
            return RpcReply.failure(callId, "File not found: " + request.argument(FileStorageClient.ARG_DIGEST, String.class));
        } catch (IOException e) {
            log.error("Storage I/O error on {}: {}", request.getMethod(), e.getMessage(), e);
            return RpcReply.failure(callId, "Storage error: " + e.getMessage());
        } catch (ClassCastException | IllegalArgumentException e) {
            return RpcReply.failure(callId, "Invalid arguments: " + e.getMessage());
        }
    }

    @Override
    public boolean ping() {
        log.debug("Ping received");
        return true;
    }

    /**
     * Stores content, returning its digest. Existing content is not rewritten.
     *
     * @throws IOException if the content cannot be written
     */
    public String putFile(byte[] data, String description) throws IOException {
        String digest = sha1Hex(data);
        Path target = directory.resolve(digest);
        if (!Files.exists(target)) {
            // Write to a temp file first so readers never see partial content
            Path temp = Files.createTempFile(directory, digest, ".tmp");
            Files.write(temp, data);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Stored {} ({} bytes): {}", digest, data.length, description);
        } else {
            log.debug("Content {} already present", digest);
        }
        if (description != null) {
            Files.write(directory.resolve(digest + DESCRIPTION_SUFFIX), description.getBytes(StandardCharsets.UTF_8));
        }
        return digest;
    }

    /**
     * @throws NoSuchFileException if no content has this digest
     * @throws IllegalArgumentException if the digest is malformed
     */
    public byte[] getFile(String digest) throws IOException {
        return Files.readAllBytes(contentPath(digest));
    }

    /**
     * @return the stored description, or an empty string if none was given
     * @throws NoSuchFileException if no content has this digest
     */
    public String describe(String digest) throws IOException {
        Path content = contentPath(digest);
        if (!Files.exists(content)) {
            throw new NoSuchFileException(digest);
        }
        Path description = directory.resolve(digest + DESCRIPTION_SUFFIX);
        return Files.exists(description) ? Files.readString(description, StandardCharsets.UTF_8) : "";
    }

    private Path contentPath(String digest) {
        // Digests name files directly: refuse anything that is not a plain hex digest
        if (digest == null || !DIGEST.matcher(digest).matches()) {
            throw new IllegalArgumentException("Malformed digest: " + digest);
        }
        return directory.resolve(digest);
    }

    /**
     * Graceful shutdown: unbinds from the registry and unexports the object.
     */
    public synchronized void shutdown() {
        log.info("Shutting down FileStorage {}...", coord);

        try {
            if (registry != null) {
                registry.unbind(RmiServiceLocator.bindingName(coord));
                UnicastRemoteObject.unexportObject(registry, true);
            }
        } catch (Exception e) {
            log.warn("Error unbinding from registry: {}", e.getMessage());
        }

        try {
            if (exported) {
                UnicastRemoteObject.unexportObject(this, true);
                exported = false;
            }
        } catch (Exception e) {
            log.warn("Error unexporting RMI object: {}", e.getMessage());
        }

        log.info("[OK] FileStorage {} shut down cleanly", coord);
    }

    static String sha1Hex(byte[] data) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            return bytesToHex(sha1.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    /**
     * Converts byte array to lowercase hex string.
     */
    private static String bytesToHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
