package com.cmsadmin.rpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * The single logical worker on which every RPC continuation runs.
 *
 * Continuations are executed one at a time, in submission order, on one daemon thread:
 * two callbacks never run concurrently with each other.
 * A continuation that throws is logged and does not stop the loop.
 */
public class EventLoop {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final String name;
    private final ExecutorService executor;
    private volatile Thread loopThread;

    /**
     * @param name descriptive name, used for the thread name and logging
     */
    public EventLoop(String name) {
        this.name = name;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("EventLoop-" + name);
            thread.setDaemon(true);  // Don't prevent JVM shutdown
            loopThread = thread;
            return thread;
        });
    }

    /**
     * Queues a continuation for execution on the loop thread.
     * Silently ignored (with a warning) once the loop is shut down.
     *
     * @param task continuation to run
     */
    public void execute(Runnable task) {
        try {
            executor.execute(() -> runSafely(task));
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Event loop stopped, continuation dropped", name);
        }
    }

    /**
     * @return true when called from the loop thread itself
     */
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            // Catch-all: one broken continuation must not take down unrelated requests
            log.error("[{}] Continuation failed: {}", name, e.getMessage(), e);
        }
    }

    /**
     * Stops accepting continuations and waits briefly for the queued ones.
     * Safe to call multiple times.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[{}] Event loop stopped", name);
    }
}
