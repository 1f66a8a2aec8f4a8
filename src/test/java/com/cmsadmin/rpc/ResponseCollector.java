package com.cmsadmin.rpc;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * RpcCallback that records every response (and the thread it ran on) for later assertions.
 */
public class ResponseCollector implements RpcCallback {

    private final BlockingQueue<RpcResponse> responses = new LinkedBlockingQueue<>();
    private final BlockingQueue<String> threads = new LinkedBlockingQueue<>();

    @Override
    public void onComplete(RpcResponse response) {
        threads.add(Thread.currentThread().getName());
        responses.add(response);
    }

    /**
     * Waits for the next response.
     * @throws AssertionError if nothing arrives within 5 seconds
     */
    public RpcResponse next() throws InterruptedException {
        RpcResponse response = responses.poll(5, TimeUnit.SECONDS);
        if (response == null) {
            throw new AssertionError("No response within 5 seconds");
        }
        return response;
    }

    /**
     * @return a further response within the wait, or null if none arrived
     */
    public RpcResponse poll(long waitMs) throws InterruptedException {
        return responses.poll(waitMs, TimeUnit.MILLISECONDS);
    }

    public String lastThread() throws InterruptedException {
        return threads.poll(5, TimeUnit.SECONDS);
    }
}
