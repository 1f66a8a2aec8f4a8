package com.cmsadmin.rpc;

import com.cmsadmin.service.ServiceCoord;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One in-flight call, owned by the RpcChannel that issued it.
 * Completion is a one-way latch: only the first outcome wins.
 */
final class PendingCall {

    private final long callId;
    private final ServiceCoord target;
    private final String method;
    private final Object tag;
    private final RpcCallback callback;
    private final long issuedAt;

    private final AtomicBoolean completed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> timeoutTask;

    PendingCall(long callId, ServiceCoord target, String method, Object tag, RpcCallback callback) {
        this.callId = callId;
        this.target = target;
        this.method = method;
        this.tag = tag;
        this.callback = callback;
        this.issuedAt = System.currentTimeMillis();
    }

    long getCallId() {
        return callId;
    }

    String getMethod() {
        return method;
    }

    Object getTag() {
        return tag;
    }

    RpcCallback getCallback() {
        return callback;
    }

    long getAgeMs() {
        return System.currentTimeMillis() - issuedAt;
    }

    void setTimeoutTask(ScheduledFuture<?> timeoutTask) {
        this.timeoutTask = timeoutTask;
        if (completed.get()) {
            timeoutTask.cancel(false);  // completed before the timer was armed
        }
    }

    /**
     * Marks the call as completed.
     * @return true for the first caller only, false for every redelivery
     */
    boolean tryComplete() {
        if (!completed.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> task = timeoutTask;
        if (task != null) {
            task.cancel(false);
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("PendingCall[#%d %s.%s, tag=%s]", callId, target, method, tag);
    }
}
