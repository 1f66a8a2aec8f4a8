package com.cmsadmin.rpc;

import com.cmsadmin.config.AdminConfig;
import com.cmsadmin.service.ServiceAddress;
import com.cmsadmin.service.ServiceCoord;
import com.cmsadmin.service.ServiceRegistry;
import com.cmsadmin.service.UnknownServiceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for outgoing RPCs of this process.
 * Keeps one RpcChannel per ServiceCoord and resolves coordinates through the ServiceRegistry.
 *
 * Calls made through this class are trusted (server initiated):
 * browser-originated calls must go through the authorization gate first.
 */
public class RpcClient {
    private static final Logger log = LoggerFactory.getLogger(RpcClient.class);

    private final ServiceRegistry registry;
    private final ServiceLocator locator;
    private final EventLoop eventLoop;
    private final long timeoutMs;
    private final long reconnectIntervalMs;

    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService scheduler;
    private final Map<ServiceCoord, RpcChannel> channels = new ConcurrentHashMap<>();

    /**
     * Creates a client that talks RMI.
     */
    public RpcClient(AdminConfig config, EventLoop eventLoop) {
        this(config, new RmiServiceLocator(), eventLoop);
    }

    /**
     * @param config registry and timing configuration
     * @param locator how remote references are obtained
     * @param eventLoop where continuations run
     */
    public RpcClient(AdminConfig config, ServiceLocator locator, EventLoop eventLoop) {
        this.registry = config.getServiceRegistry();
        this.locator = Objects.requireNonNull(locator, "locator cannot be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop cannot be null");
        this.timeoutMs = config.getRpcTimeoutMs();
        this.reconnectIntervalMs = config.getReconnectIntervalMs();

        AtomicInteger ioThreads = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("RpcClient-io-" + ioThreads.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = Executors.newScheduledThreadPool(1, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("RpcClient-timer");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns the channel to a shard, creating and connecting it on first use.
     * Blocks while a new channel makes its first connection attempt: meant for start-up,
     * never for continuations.
     * A channel that fails to connect is still returned: it keeps reconnecting in background.
     *
     * @param coord target shard
     * @return the channel for that shard
     * @throws UnknownServiceException if the coordinate is not configured
     */
    public RpcChannel connectTo(ServiceCoord coord) throws UnknownServiceException {
        RpcChannel existing = channels.get(coord);
        if (existing != null) {
            return existing;
        }
        RpcChannel channel = channel(coord);
        if (!channel.isConnected()) {
            channel.connect();
        }
        return channel;
    }

    /**
     * Returns the channel to a shard without connecting it.
     * A new channel connects on the I/O executor when its first call is issued.
     */
    private RpcChannel channel(ServiceCoord coord) throws UnknownServiceException {
        RpcChannel existing = channels.get(coord);
        if (existing != null) {
            return existing;
        }

        ServiceAddress address = registry.address(coord);
        RpcChannel channel = new RpcChannel(coord, address, locator, eventLoop,
            ioExecutor, scheduler, timeoutMs, reconnectIntervalMs);
        RpcChannel raced = channels.putIfAbsent(coord, channel);
        return raced != null ? raced : channel; // somebody else may have created it first
    }

    /**
     * Issues a trusted RPC to a shard.
     * Addressing errors are reported through the callback like every other failure.
     *
     * @return true if the call was sent, false if it already failed
     */
    public boolean invoke(ServiceCoord coord, String method, Map<String, ? extends Serializable> arguments,
                          RpcCallback callback, Object tag) {
        Objects.requireNonNull(callback, "callback cannot be null");
        RpcChannel channel;
        try {
            channel = channel(coord);
        } catch (UnknownServiceException e) {
            log.warn("Cannot address {}: {}", coord, e.getMessage());
            eventLoop.execute(() -> callback.onComplete(RpcResponse.failure(tag, e.getMessage())));
            return false;
        }
        return channel.invoke(method, arguments, callback, tag);
    }

    public ServiceRegistry getRegistry() {
        return registry;
    }

    public EventLoop getEventLoop() {
        return eventLoop;
    }

    /**
     * Closes every channel and stops the internal threads.
     * The EventLoop is owned by the caller and is not stopped here.
     */
    public void shutdown() {
        for (RpcChannel channel : new ArrayList<>(channels.values())) {
            channel.close();
        }
        channels.clear();
        scheduler.shutdownNow();
        ioExecutor.shutdownNow();
        try {
            ioExecutor.awaitTermination(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("RpcClient shut down");
    }
}
