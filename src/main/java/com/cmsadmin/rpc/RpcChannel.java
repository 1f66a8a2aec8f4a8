package com.cmsadmin.rpc;

import com.cmsadmin.rmi.RemoteService;
import com.cmsadmin.rmi.RpcReply;
import com.cmsadmin.rmi.RpcRequest;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.rmi.NotBoundException;
import java.rmi.RemoteException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persistent, reconnecting logical connection to one service shard.
 *
 * invoke() never blocks: the remote call runs on the I/O executor and the
 * continuation is resumed on the EventLoop. Every call ends in exactly one
 * callback, whichever comes first among reply, transport error and timeout.
 *
 * Disconnection policy: fail fast. A call issued while the channel is down is
 * failed immediately with "Connection failed." and a background reconnect loop
 * keeps trying every reconnectIntervalMs. Nothing is queued.
 *
 * A channel that has never tried to connect makes its first attempt on the I/O
 * executor, together with the call that needed it.
 */
public class RpcChannel {
    private static final Logger log = LoggerFactory.getLogger(RpcChannel.class);

    public static final String CONNECTION_FAILED = "Connection failed.";

    // Transport-level call ids, unique within this process
    private static final AtomicLong CALL_IDS = new AtomicLong();

    private final ServiceCoord coord;
    private final ServiceAddress address;
    private final ServiceLocator locator;
    private final EventLoop eventLoop;
    private final ExecutorService ioExecutor; // runs the blocking remote calls
    private final ScheduledExecutorService scheduler; // timeouts and reconnect attempts
    private final long timeoutMs;
    private final long reconnectIntervalMs;

    private final Map<Long, PendingCall> pendingCalls = new ConcurrentHashMap<>();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    private final Object connectLock = new Object();

    private volatile RemoteService remote; // null while disconnected
    private volatile boolean initialAttemptDone = false;
    private volatile boolean closed = false;

    public RpcChannel(ServiceCoord coord, ServiceAddress address, ServiceLocator locator, EventLoop eventLoop,
                      ExecutorService ioExecutor, ScheduledExecutorService scheduler,
                      long timeoutMs, long reconnectIntervalMs) {
        this.coord = Objects.requireNonNull(coord, "coord cannot be null");
        this.address = Objects.requireNonNull(address, "address cannot be null");
        this.locator = Objects.requireNonNull(locator, "locator cannot be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop cannot be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.timeoutMs = timeoutMs;
        this.reconnectIntervalMs = reconnectIntervalMs;
    }

    /**
     * Connects to the shard, blocking until the lookup and first ping complete.
     * On failure the reconnect loop is started and false is returned.
     *
     * @return true if the channel is connected
     */
    public boolean connect() {
        synchronized (connectLock) {
            boolean connected = tryConnect();
            initialAttemptDone = true;
            if (!connected) {
                scheduleReconnect();
            }
            return connected;
        }
    }

    /**
     * Issues a remote call without blocking the caller.
     *
     * @param method remote method name
     * @param arguments method arguments (may be empty)
     * @param callback continuation, called exactly once on the EventLoop
     * @param tag caller's correlation key, handed back in the response
     * @return true if the call was sent, false if it already failed
     *         (the failure is reported through the callback in both cases)
     */
    public boolean invoke(String method, Map<String, ? extends Serializable> arguments,
                          RpcCallback callback, Object tag) {
        Objects.requireNonNull(callback, "callback cannot be null");
        PendingCall call = new PendingCall(CALL_IDS.incrementAndGet(), coord, method, tag, callback);

        if (closed) {
            fail(call, "Channel to " + coord + " is closed");
            return false;
        }

        RemoteService target = remote;
        if (target == null && initialAttemptDone) {
            log.warn("[{}] Not connected, failing {} immediately", coord, method);
            fail(call, CONNECTION_FAILED);
            scheduleReconnect();
            return false;
        }

        RpcRequest request;
        try {
            request = new RpcRequest(call.getCallId(), coord, method, arguments);
        } catch (NullPointerException | IllegalArgumentException e) {
            fail(call, "Invalid call: " + e.getMessage());
            return false;
        }

        pendingCalls.put(call.getCallId(), call);
        try {
            call.setTimeoutTask(scheduler.schedule(
                () -> fail(call, "Timed out after " + timeoutMs + " ms"),
                timeoutMs,
                TimeUnit.MILLISECONDS
            ));
            if (target != null) {
                ioExecutor.execute(() -> send(target, request, call));
            } else {
                ioExecutor.execute(() -> connectAndSend(request, call));
            }
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Executor rejected call {}: {}", coord, method, e.getMessage());
            fail(call, CONNECTION_FAILED);
            return false;
        }

        log.debug("[{}] Call #{} {} issued (tag={})", coord, call.getCallId(), method, tag);
        return true;
    }

    /**
     * Runs on the I/O executor. Blocks on the remote call and routes the outcome.
     */
    private void send(RemoteService target, RpcRequest request, PendingCall call) {
        try {
            RpcReply reply = target.invoke(request);
            if (reply == null || reply.getCallId() != request.getCallId()) {
                // Reply for some other call: treat as a broken transport
                fail(call, "Mismatched reply for call #" + request.getCallId());
            } else if (reply.isSuccess()) {
                complete(call, RpcResponse.success(call.getTag(), reply.getResult()));
            } else {
                fail(call, reply.getError());
            }
        } catch (RemoteException e) {
            log.warn("[{}] Transport error on {}: {}", coord, request.getMethod(), e.getClass().getSimpleName());
            markDisconnected(target);
            fail(call, "Transport error: " + describe(e));
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error on {}: {}", coord, request.getMethod(), e.getMessage(), e);
            fail(call, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Runs on the I/O executor for calls issued before the first connection attempt.
     */
    private void connectAndSend(RpcRequest request, PendingCall call) {
        RemoteService target = awaitInitialAttempt();
        if (target == null) {
            fail(call, CONNECTION_FAILED);
            return;
        }
        send(target, request, call);
    }

    /**
     * Makes the first connection attempt, or waits for the one already running.
     * @return the remote reference, or null if the channel is not connected
     */
    private RemoteService awaitInitialAttempt() {
        synchronized (connectLock) {
            if (!initialAttemptDone && !closed) {
                boolean connected = tryConnect();
                initialAttemptDone = true;
                if (!connected) {
                    scheduleReconnect();
                }
            }
        }
        return closed ? null : remote;
    }

    private void fail(PendingCall call, String error) {
        complete(call, RpcResponse.failure(call.getTag(), error));
    }

    /**
     * Delivers the outcome of a call to its continuation, at most once.
     */
    private void complete(PendingCall call, RpcResponse response) {
        if (!call.tryComplete()) {
            log.debug("[{}] Discarding late outcome for call #{} after {}ms", coord, call.getCallId(), call.getAgeMs());
            return;
        }
        pendingCalls.remove(call.getCallId());
        if (!response.isSuccess()) {
            log.debug("[{}] Call #{} {} failed: {}", coord, call.getCallId(), call.getMethod(), response.getError());
        }
        eventLoop.execute(() -> call.getCallback().onComplete(response));
    }

    private boolean tryConnect() {
        try {
            RemoteService service = locator.locate(coord, address);
            service.ping();
            remote = service;
            log.info("[OK] Connected to {} at {}", coord, address);
            return true;
        } catch (RemoteException | NotBoundException e) {
            log.warn("[{}] Cannot connect to {}: {}", coord, address, describe(e));
            return false;
        } catch (RuntimeException e) {
            log.error("[{}] Unexpected error connecting to {}: {}", coord, address, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Drops the current remote reference if it is still the one that failed.
     */
    private void markDisconnected(RemoteService failed) {
        if (remote == failed) {
            remote = null;
            log.warn("[{}] Connection lost", coord);
        }
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed || !reconnecting.compareAndSet(false, true)) {
            return; // already running
        }
        log.info("[{}] Reconnecting every {}ms", coord, reconnectIntervalMs);
        scheduleReconnectAttempt();
    }

    private void scheduleReconnectAttempt() {
        try {
            scheduler.schedule(this::attemptReconnect, reconnectIntervalMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            reconnecting.set(false);
        }
    }

    private void attemptReconnect() {
        if (closed) {
            reconnecting.set(false);
            return;
        }
        if (remote != null || tryConnect()) {
            reconnecting.set(false);
            return;
        }
        scheduleReconnectAttempt();
    }

    /**
     * @return true if a remote reference is currently held
     */
    public boolean isConnected() {
        return remote != null;
    }

    /**
     * @return number of calls still waiting for their outcome
     */
    public int getPendingCallCount() {
        return pendingCalls.size();
    }

    public ServiceCoord getCoord() {
        return coord;
    }

    /**
     * Closes the channel. Calls still pending are failed, later calls fail immediately.
     */
    public void close() {
        closed = true;
        remote = null;
        List<PendingCall> outstanding = new ArrayList<>(pendingCalls.values());
        for (PendingCall call : outstanding) {
            fail(call, "Channel to " + coord + " is closed");
        }
        log.info("[{}] Channel closed ({} pending call(s) failed)", coord, outstanding.size());
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
