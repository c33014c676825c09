package com.marketengine.estimation.cache;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Upstream enrichment calls allowed for one refinement. Checked before each
 * call; once spent, further calls are skipped rather than queued.
 */
public final class EnrichmentBudget {

    private final AtomicInteger used;
    private final int max;

    public EnrichmentBudget(int used, int max) {
        this.used = new AtomicInteger(used);
        this.max = max;
    }

    public static EnrichmentBudget of(int max) {
        return new EnrichmentBudget(0, max);
    }

    /** Claims one call; {@code false} when the budget is already spent. */
    public boolean tryAcquire() {
        while (true) {
            int current = used.get();
            if (current >= max) {
                return false;
            }
            if (used.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public int used() {
        return used.get();
    }

    public int max() {
        return max;
    }

    public boolean exhausted() {
        return used.get() >= max;
    }
}
