package com.titlesearch.pipeline.browser;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive hold on one pooled (or temporary) session. Closing the lease returns it to the pool.
 */
public final class BrowserLease implements AutoCloseable {
    private final BrowserPool pool;
    private final BrowserInstance instance;
    private final int requestCount;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile boolean failed;

    BrowserLease(BrowserPool pool, BrowserInstance instance, int requestCount) {
        this.pool = pool;
        this.instance = instance;
        this.requestCount = requestCount;
    }

    public BrowserSession session() {
        return instance.session();
    }

    public int slotIndex() {
        return instance.slotIndex();
    }

    public boolean isTemporary() {
        return instance.isTemporary();
    }

    /** Request count of the slot at the moment this lease was granted. */
    public int requestCount() {
        return requestCount;
    }

    /** The session errored while held; the slot is recycled on its next acquisition. */
    public void markFailed() {
        failed = true;
    }

    boolean isFailed() {
        return failed;
    }

    BrowserInstance instance() {
        return instance;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            pool.release(this);
        }
    }
}
