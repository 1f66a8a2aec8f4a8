package com.cmsadmin.storage;

import com.cmsadmin.rpc.RpcCallback;
import com.cmsadmin.rpc.RpcClient;
import com.cmsadmin.service.ServiceCoord;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Client side of the content-addressed file store.
 * Thin typed wrapper over RpcClient: results arrive through the usual RpcCallback.
 */
public class FileStorageClient {

    public static final String SERVICE_NAME = "FileStorage";

    static final String PUT_FILE = "put_file";
    static final String GET_FILE = "get_file";
    static final String DESCRIBE = "describe";

    static final String ARG_DATA = "binary_data";
    static final String ARG_DESCRIPTION = "description";
    static final String ARG_DIGEST = "digest";

    private final RpcClient rpcClient;
    private final ServiceCoord coord;

    public FileStorageClient(RpcClient rpcClient) {
        this(rpcClient, new ServiceCoord(SERVICE_NAME, 0));
    }

    public FileStorageClient(RpcClient rpcClient, ServiceCoord coord) {
        this.rpcClient = Objects.requireNonNull(rpcClient, "rpcClient cannot be null");
        this.coord = Objects.requireNonNull(coord, "coord cannot be null");
    }

    /**
     * Stores content. On success the response result is the content id (a String digest).
     * Identical content always yields the same id.
     *
     * @param data bytes to store
     * @param description human readable note kept next to the content
     * @param callback continuation
     * @param tag caller's correlation key
     * @return false if the call failed immediately (already reported to the callback)
     */
    public boolean putFile(byte[] data, String description, RpcCallback callback, Object tag) {
        Map<String, Serializable> args = new HashMap<>();
        args.put(ARG_DATA, data);
        args.put(ARG_DESCRIPTION, description);
        return rpcClient.invoke(coord, PUT_FILE, args, callback, tag);
    }

    /**
     * Fetches content. On success the response result is a byte[].
     */
    public boolean getFile(String digest, RpcCallback callback, Object tag) {
        Map<String, Serializable> args = new HashMap<>();
        args.put(ARG_DIGEST, digest);
        return rpcClient.invoke(coord, GET_FILE, args, callback, tag);
    }

    /**
     * Fetches the description stored with some content. On success the result is a String.
     */
    public boolean describe(String digest, RpcCallback callback, Object tag) {
        Map<String, Serializable> args = new HashMap<>();
        args.put(ARG_DIGEST, digest);
        return rpcClient.invoke(coord, DESCRIBE, args, callback, tag);
    }

    public ServiceCoord getCoord() {
        return coord;
    }
}
