package com.cmsadmin.rmi;

import com.cmsadmin.service.ServiceCoord;

import java.io.Serializable;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One remote call as it travels on the wire.
 * The call id correlates the reply with the call; the caller's local tag is never sent.
 */
public final class RpcRequest implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long callId;
    private final ServiceCoord target;
    private final String method;
    private final Map<String, Serializable> arguments;

    public RpcRequest(long callId, ServiceCoord target, String method, Map<String, ? extends Serializable> arguments) {
        this.callId = callId;
        this.target = Objects.requireNonNull(target, "target cannot be null");
        this.method = Objects.requireNonNull(method, "method cannot be null");
        // HashMap copy: the map itself must be serializable
        this.arguments = arguments == null ? new HashMap<>() : new HashMap<>(arguments);
    }

    public long getCallId() {
        return callId;
    }

    public ServiceCoord getTarget() {
        return target;
    }

    public String getMethod() {
        return method;
    }

    public Map<String, Serializable> getArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    /**
     * Typed access to one argument.
     * @return the argument, or null if absent
     * @throws ClassCastException if the argument has another type
     */
    public <T extends Serializable> T argument(String name, Class<T> type) {
        return type.cast(arguments.get(name));
    }

    @Override
    public String toString() {
        return String.format("RpcRequest[#%d %s.%s%s]", callId, target, method, arguments.keySet());
    }
}
