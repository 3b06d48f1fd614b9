package com.poc.integration.gate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caps the number of concurrent calls to a licensed downstream server.
 *
 * <p>All counters live under one lock, so a snapshot is always consistent and the holder count
 * can never silently pass the ceiling. A caller counts as throttled the moment it has to wait
 * or is refused, even if it is admitted later.
 */
public class LicenseGate {

    private static final Logger log = LoggerFactory.getLogger(LicenseGate.class);

    private final int ceiling;
    private final AdmissionPolicy policy;
    private final Duration acquireTimeout;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Condition slotFreed = lock.newCondition();

    private int current;
    private int peak;
    private long totalAcquired;
    private long totalThrottled;
    private long totalViolations;

    public LicenseGate(int ceiling, AdmissionPolicy policy, Duration acquireTimeout) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("Ceiling must be at least 1, got " + ceiling);
        }
        if (policy == null) {
            throw new IllegalArgumentException("Admission policy cannot be null");
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            throw new IllegalArgumentException("Acquire timeout must be non-negative");
        }
        this.ceiling = ceiling;
        this.policy = policy;
        this.acquireTimeout = acquireTimeout;
    }

    /**
     * Acquires a slot according to the configured policy.
     *
     * @throws WouldThrottleException if no slot is free (REJECT) or none freed in time (BLOCK)
     */
    public Permit acquire() throws InterruptedException {
        return switch (policy) {
            case REJECT -> tryAcquire();
            case BLOCK -> acquire(acquireTimeout);
        };
    }

    /**
     * Takes a slot only if one is free right now.
     */
    public Permit tryAcquire() {
        lock.lock();
        try {
            if (current >= ceiling) {
                totalThrottled++;
                log.debug("License slot refused: {}/{} in use", current, ceiling);
                throw new WouldThrottleException("All " + ceiling + " license slots are in use");
            }
            return admit();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for a slot.
     */
    public Permit acquire(Duration timeout) throws InterruptedException {
        long remainingNanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            if (current >= ceiling) {
                totalThrottled++;
                log.debug("Waiting for license slot: {}/{} in use", current, ceiling);
                while (current >= ceiling) {
                    if (remainingNanos <= 0) {
                        throw new WouldThrottleException("No license slot freed within " + timeout.toMillis() + "ms");
                    }
                    remainingNanos = slotFreed.awaitNanos(remainingNanos);
                }
            }
            return admit();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a slot. A permit can be released exactly once.
     *
     * @throws IllegalStateException on a second release of the same permit
     */
    public void release(Permit permit) {
        if (permit.gate != this) {
            throw new IllegalArgumentException("Permit was issued by a different gate");
        }
        if (!permit.released.compareAndSet(false, true)) {
            throw new IllegalStateException("Permit already released");
        }
        lock.lock();
        try {
            current--;
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    public LicenseUsageSnapshot stats() {
        lock.lock();
        try {
            return new LicenseUsageSnapshot(current, peak, totalAcquired, totalThrottled, totalViolations, ceiling);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the cumulative counters. Slots currently held stay held and seed the new peak.
     */
    public void reset() {
        lock.lock();
        try {
            peak = current;
            totalAcquired = 0;
            totalThrottled = 0;
            totalViolations = 0;
            log.info("License usage counters reset");
        } finally {
            lock.unlock();
        }
    }

    public int getCeiling() {
        return ceiling;
    }

    public AdmissionPolicy getPolicy() {
        return policy;
    }

    // Caller holds the lock.
    private Permit admit() {
        current++;
        totalAcquired++;
        if (current > peak) {
            peak = current;
        }
        if (current > ceiling) {
            totalViolations++;
            current--;
            log.error("License ceiling exceeded: {} holders for {} slots", current + 1, ceiling);
            throw new GateInvariantViolationException(
                "License ceiling " + ceiling + " exceeded with " + (current + 1) + " holders");
        }
        return new Permit(this);
    }

    /**
     * Proof of a held slot. Closing it releases the slot.
     */
    public static final class Permit implements AutoCloseable {

        private final LicenseGate gate;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit(LicenseGate gate) {
            this.gate = gate;
        }

        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void close() {
            if (!released.get()) {
                gate.release(this);
            }
        }
    }
}
