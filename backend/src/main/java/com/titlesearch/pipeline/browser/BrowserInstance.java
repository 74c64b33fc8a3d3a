package com.titlesearch.pipeline.browser;

import java.time.Instant;

/**
 * Mutable slot state, guarded by the owning pool's slot lock.
 */
final class BrowserInstance {
    static final int TEMPORARY_SLOT = -1;

    private final int slotIndex;
    private final boolean temporary;
    private BrowserSession session;
    private boolean inUse;
    private String affinityKey;
    private Instant createdAt;
    private int requestCount;

    BrowserInstance(int slotIndex, BrowserSession session, boolean temporary) {
        this.slotIndex = slotIndex;
        this.session = session;
        this.temporary = temporary;
        this.createdAt = Instant.now();
    }

    int slotIndex() {
        return slotIndex;
    }

    boolean isTemporary() {
        return temporary;
    }

    BrowserSession session() {
        return session;
    }

    void replaceSession(BrowserSession session) {
        this.session = session;
        this.createdAt = Instant.now();
    }

    boolean isInUse() {
        return inUse;
    }

    void setInUse(boolean inUse) {
        this.inUse = inUse;
    }

    String affinityKey() {
        return affinityKey;
    }

    void setAffinityKey(String affinityKey) {
        this.affinityKey = affinityKey;
    }

    Instant createdAt() {
        return createdAt;
    }

    int requestCount() {
        return requestCount;
    }

    void setRequestCount(int requestCount) {
        this.requestCount = requestCount;
    }
}
