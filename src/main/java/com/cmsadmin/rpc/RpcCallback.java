package com.cmsadmin.rpc;

/**
 * Continuation resumed when an RPC completes.
 * Invoked exactly once per call, on the EventLoop thread.
 */
@FunctionalInterface
public interface RpcCallback {
    /**
     * @param response success with (result, tag) or failure with (tag, error)
     */
    void onComplete(RpcResponse response);
}
