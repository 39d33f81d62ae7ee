package com.vcc.llmgateway.service;

import com.vcc.llmgateway.model.Identity;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Budget units taken from a credential for one in-flight request.
 * Ends exactly once: settled (kept) when a response was produced, released
 * (refunded) when the request ended without one.
 */
public class BudgetReservation {

    private final Identity identity;
    private final long units;
    private final long remainingAfter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    BudgetReservation(Identity identity, long units, long remainingAfter) {
        this.identity = identity;
        this.units = units;
        this.remainingAfter = remainingAfter;
    }

    public Identity getIdentity() {
        return identity;
    }

    public long getUnits() {
        return units;
    }

    /**
     * Budget left on the credential right after this reservation was taken.
     */
    public long getRemainingAfter() {
        return remainingAfter;
    }

    /**
     * @return true for the first caller only
     */
    boolean close() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }
}
