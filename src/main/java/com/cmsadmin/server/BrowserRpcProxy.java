package com.cmsadmin.server;

import com.cmsadmin.auth.AuthorizationGate;
import com.cmsadmin.rpc.RpcCallback;
import com.cmsadmin.rpc.RpcClient;
import com.cmsadmin.rpc.RpcResponse;
import com.cmsadmin.service.ServiceCoord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Map;

/**
 * Forwards RPCs requested by the browser, after checking them against the allow-list.
 * A denied call never reaches the network: the caller gets a failed response instead.
 */
public class BrowserRpcProxy {
    private static final Logger log = LoggerFactory.getLogger(BrowserRpcProxy.class);

    public static final String UNAUTHORIZED = "Unauthorized RPC call";

    private final AuthorizationGate gate;
    private final RpcClient rpcClient;

    public BrowserRpcProxy(AuthorizationGate gate, RpcClient rpcClient) {
        this.gate = gate;
        this.rpcClient = rpcClient;
    }

    /**
     * @return true if the call was forwarded and sent, false if it was denied or failed immediately
     */
    public boolean call(ServiceCoord service, String method, Map<String, ? extends Serializable> arguments,
                        RpcCallback callback, Object tag) {
        if (!gate.allow(service, method, arguments)) {
            log.warn("Denied browser RPC {}.{}", service, method);
            rpcClient.getEventLoop().execute(() -> callback.onComplete(RpcResponse.failure(tag, UNAUTHORIZED)));
            return false;
        }
        log.debug("Forwarding browser RPC {}.{}", service, method);
        return rpcClient.invoke(service, method, arguments, callback, tag);
    }
}
