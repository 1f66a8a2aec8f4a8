package com.cmsadmin.rpc;

import java.io.Serializable;

/**
 * Outcome of one RPC as seen by the caller's continuation.
 *
 * 2 possible states:
 * - success, carrying the remote result and the caller's tag
 * - failure, carrying the caller's tag and an error description
 *
 * The tag is whatever the caller passed to invoke(); it never leaves this process.
 */
public final class RpcResponse {

    private final Object tag;
    private final Serializable result;
    private final String error;

    /**
     * Private constructor - use factory methods.
     */
    private RpcResponse(Object tag, Serializable result, String error) {
        this.tag = tag;
        this.result = result;
        this.error = error;
    }

    public static RpcResponse success(Object tag, Serializable result) {
        return new RpcResponse(tag, result, null);
    }

    public static RpcResponse failure(Object tag, String error) {
        return new RpcResponse(tag, null, error == null ? "Unknown error" : error);
    }

    public Object getTag() {
        return tag;
    }

    public Serializable getResult() {
        return result;
    }

    /**
     * Typed access to the result.
     * @throws ClassCastException if the result has another type
     */
    public <T> T getResultAs(Class<T> type) {
        return type.cast(result);
    }

    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return isSuccess()
            ? String.format("RpcResponse[tag=%s: SUCCESS, result=%s]", tag, result)
            : String.format("RpcResponse[tag=%s: FAILURE, error=%s]", tag, error);
    }
}
