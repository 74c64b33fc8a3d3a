package com.titlesearch.pipeline.browser;

import com.titlesearch.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed-capacity pool of browser sessions shared by all scrapes running in this process.
 *
 * <p>One lock guards the slot list, so scanning for a free slot and marking it in use happen
 * atomically. A held session is exclusive to its lease holder and needs no further locking. Slots
 * are recycled once their request count exceeds the configured threshold, or on the acquisition
 * after a holder reported an error. When every slot stays busy for the whole poll window a
 * temporary session is created outside the pool and destroyed on release.
 */
public class BrowserPool {
    private static final Logger log = LoggerFactory.getLogger(BrowserPool.class);

    private final BrowserSessionFactory sessionFactory;
    private final int poolSize;
    private final int maxRequestsPerInstance;
    private final int pollIntervalMs;
    private final int maxPolls;
    private final Object slotLock = new Object();
    private final List<BrowserInstance> slots = new ArrayList<>();
    private final AtomicInteger temporaryInUse = new AtomicInteger();

    private boolean initialized;
    private boolean initializing;
    private boolean shutdown;

    public BrowserPool(BrowserSessionFactory sessionFactory, PipelineProperties.Browser settings) {
        this.sessionFactory = sessionFactory;
        this.poolSize = settings.getPoolSize();
        this.maxRequestsPerInstance = settings.getMaxRequestsPerInstance();
        this.pollIntervalMs = settings.getAcquirePollIntervalMs();
        this.maxPolls = settings.getAcquireMaxPolls();
    }

    /**
     * Launches the pool's sessions. Launching happens outside the slot lock so stats and shutdown
     * stay responsive; concurrent callers wait for the first one to publish the slots.
     */
    public void initialize() {
        synchronized (slotLock) {
            while (initializing) {
                awaitInitialization();
            }
            if (initialized) {
                return;
            }
            if (shutdown) {
                throw new BrowserPoolException("Browser pool has been shut down");
            }
            initializing = true;
        }

        List<BrowserInstance> created = new ArrayList<>();
        try {
            for (int i = 0; i < poolSize; i++) {
                created.add(new BrowserInstance(i, sessionFactory.create(), false));
            }
        } catch (RuntimeException e) {
            created.forEach(instance -> closeQuietly(instance.session(), instance.slotIndex()));
            finishInitialization(false);
            throw new BrowserPoolException("Failed to initialize browser pool: " + e.getMessage(), e);
        }

        synchronized (slotLock) {
            if (shutdown) {
                created.forEach(instance -> closeQuietly(instance.session(), instance.slotIndex()));
                finishInitialization(false);
                throw new BrowserPoolException("Browser pool has been shut down");
            }
            slots.addAll(created);
            finishInitialization(true);
        }
        log.info("Browser pool initialized with {} instances", poolSize);
    }

    private void finishInitialization(boolean succeeded) {
        synchronized (slotLock) {
            initializing = false;
            initialized = succeeded;
            slotLock.notifyAll();
        }
    }

    private void awaitInitialization() {
        try {
            slotLock.wait();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while waiting for the browser pool to start", e);
        }
    }

    public BrowserLease acquire(String affinityKey) {
        initialize();
        for (int poll = 0; ; poll++) {
            BrowserLease lease = tryAcquire(affinityKey);
            if (lease != null) {
                return lease;
            }
            if (poll >= maxPolls) {
                break;
            }
            sleep(pollIntervalMs);
        }

        log.warn("Browser pool exhausted: all {} instances in use, creating temporary instance", poolSize);
        BrowserSession session;
        try {
            session = sessionFactory.create();
        } catch (RuntimeException e) {
            throw new BrowserPoolException("Failed to create temporary browser instance: " + e.getMessage(), e);
        }
        BrowserInstance temporary = new BrowserInstance(BrowserInstance.TEMPORARY_SLOT, session, true);
        temporary.setInUse(true);
        temporary.setAffinityKey(affinityKey);
        temporary.setRequestCount(1);
        temporaryInUse.incrementAndGet();
        return new BrowserLease(this, temporary, 1);
    }

    /**
     * Runs {@code work} with an exclusive session. A failure marks the session for recycling before
     * it goes back to the pool.
     */
    public <T> T withSession(String affinityKey, Function<BrowserSession, T> work) {
        try (BrowserLease lease = acquire(affinityKey)) {
            try {
                return work.apply(lease.session());
            } catch (RuntimeException e) {
                lease.markFailed();
                throw e;
            }
        }
    }

    void release(BrowserLease lease) {
        BrowserInstance instance = lease.instance();
        if (instance.isTemporary()) {
            closeQuietly(instance.session(), instance.slotIndex());
            temporaryInUse.decrementAndGet();
            return;
        }
        synchronized (slotLock) {
            if (lease.isFailed()) {
                instance.setRequestCount(maxRequestsPerInstance + 1);
            }
            instance.setInUse(false);
        }
    }

    public void shutdown() {
        synchronized (slotLock) {
            shutdown = true;
            for (BrowserInstance instance : slots) {
                closeQuietly(instance.session(), instance.slotIndex());
            }
            int closed = slots.size();
            slots.clear();
            initialized = false;
            if (closed > 0) {
                log.info("Browser pool shut down, closed {} instances", closed);
            }
        }
    }

    public PoolStats stats() {
        synchronized (slotLock) {
            int inUse = 0;
            for (BrowserInstance instance : slots) {
                if (instance.isInUse()) {
                    inUse++;
                }
            }
            return new PoolStats(poolSize, slots.size(), inUse, slots.size() - inUse, temporaryInUse.get(), initialized);
        }
    }

    private BrowserLease tryAcquire(String affinityKey) {
        BrowserInstance chosen;
        boolean needsRecycle;
        synchronized (slotLock) {
            if (shutdown) {
                throw new BrowserPoolException("Browser pool has been shut down");
            }
            chosen = findIdle(affinityKey);
            if (chosen == null) {
                return null;
            }
            chosen.setInUse(true);
            chosen.setRequestCount(chosen.requestCount() + 1);
            if (affinityKey != null) {
                chosen.setAffinityKey(affinityKey);
            }
            needsRecycle = chosen.requestCount() > maxRequestsPerInstance || chosen.session() == null;
            if (!needsRecycle) {
                return new BrowserLease(this, chosen, chosen.requestCount());
            }
        }
        // The slot is marked in use, so nobody else touches it while the session is replaced.
        recycle(chosen);
        synchronized (slotLock) {
            chosen.setRequestCount(1);
            return new BrowserLease(this, chosen, 1);
        }
    }

    private BrowserInstance findIdle(String affinityKey) {
        if (affinityKey != null) {
            for (BrowserInstance instance : slots) {
                if (!instance.isInUse() && affinityKey.equals(instance.affinityKey())) {
                    return instance;
                }
            }
        }
        for (BrowserInstance instance : slots) {
            if (!instance.isInUse()) {
                return instance;
            }
        }
        return null;
    }

    private void recycle(BrowserInstance instance) {
        log.info("Recycling browser instance {} after {} requests", instance.slotIndex(), instance.requestCount() - 1);
        BrowserSession old = instance.session();
        if (old != null) {
            closeQuietly(old, instance.slotIndex());
        }
        try {
            instance.replaceSession(sessionFactory.create());
        } catch (RuntimeException e) {
            synchronized (slotLock) {
                instance.replaceSession(null);
                instance.setInUse(false);
            }
            throw new BrowserPoolException("Failed to recycle browser instance " + instance.slotIndex(), e);
        }
    }

    private void closeQuietly(BrowserSession session, int slotIndex) {
        if (session == null) {
            return;
        }
        try {
            session.close();
        } catch (Exception e) {
            log.warn("Failed to close browser instance {}", slotIndex, e);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserPoolException("Interrupted while waiting for a browser instance", e);
        }
    }
}
