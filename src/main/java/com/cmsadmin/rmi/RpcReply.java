package com.cmsadmin.rmi;

import java.io.Serializable;

/**
 * Reply to an RpcRequest: either a result or an error description, never both.
 *
 * Created by the backend service through the factory methods.
 */
public final class RpcReply implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long callId;
    private final Serializable result;
    private final String error;

    /**
     * Private constructor - use factory methods.
     */
    private RpcReply(long callId, Serializable result, String error) {
        this.callId = callId;
        this.result = result;
        this.error = error;
    }

    /**
     * @param callId id of the request being answered
     * @param result method result (may be null for void methods)
     */
    public static RpcReply success(long callId, Serializable result) {
        return new RpcReply(callId, result, null);
    }

    /**
     * @param callId id of the request being answered
     * @param error human readable description of what went wrong
     */
    public static RpcReply failure(long callId, String error) {
        return new RpcReply(callId, null, error == null ? "Unknown error" : error);
    }

    public long getCallId() {
        return callId;
    }

    public Serializable getResult() {
        return result;
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
            ? String.format("RpcReply[#%d: SUCCESS]", callId)
            : String.format("RpcReply[#%d: FAILURE, error=%s]", callId, error);
    }
}
