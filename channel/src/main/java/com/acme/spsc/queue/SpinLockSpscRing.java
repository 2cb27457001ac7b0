package com.acme.spsc.queue;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded single-producer single-consumer ring guarded by a spin lock.
 *
 * <p>Cursor reads, the capacity check, the slot access and the cursor update run as one
 * critical section on each side. The lock is taken with a busy-retry loop and released
 * in {@code finally} on every path, including the full and empty outcomes; the thread is
 * never parked. Mutual exclusion replaces the acquire/release argument of
 * {@link LockFreeSpscRing}: the unlocking volatile write publishes everything done under
 * the lock to the next locker.</p>
 */
public final class SpinLockSpscRing<E> implements BoundedRing<E> {

    private final Object[] buffer;
    private final int capacity;
    private final AtomicBoolean locked = new AtomicBoolean(false);

    // guarded by locked
    private long writeCursor;
    private long readCursor;

    public SpinLockSpscRing(int capacity) {
        this.capacity = BoundedRing.checkCapacity(capacity);
        this.buffer = new Object[capacity];
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int sizeApprox() {
        lock();
        try {
            return (int) (writeCursor - readCursor);
        } finally {
            unlock();
        }
    }

    @Override
    public OfferResult offer(E e) {
        Objects.requireNonNull(e, "e");
        lock();
        try {
            long depth = writeCursor - readCursor;
            if (depth >= capacity) {
                return new OfferResult.Full((int) depth, capacity);
            }
            long pos = writeCursor;
            int slot = slotIndex(pos);
            if (buffer[slot] != null) {
                throw new IllegalStateException("Slot " + slot + " still occupied at write cursor " + pos);
            }
            buffer[slot] = e;
            writeCursor = pos + 1;
            return new OfferResult.Ok(pos);
        } finally {
            unlock();
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public E poll() {
        lock();
        try {
            long pos = readCursor;
            if (pos >= writeCursor) {
                return null;
            }
            int slot = slotIndex(pos);
            E value = (E) buffer[slot];
            if (value == null) {
                throw new IllegalStateException("Slot " + slot + " empty below write cursor " + writeCursor);
            }
            buffer[slot] = null;
            readCursor = pos + 1;
            return value;
        } finally {
            unlock();
        }
    }

    @Override
    public long writeCursor() {
        lock();
        try {
            return writeCursor;
        } finally {
            unlock();
        }
    }

    @Override
    public long readCursor() {
        lock();
        try {
            return readCursor;
        } finally {
            unlock();
        }
    }

    @Override
    public RingSnapshot snapshot() {
        lock();
        try {
            return new RingSnapshot(readCursor, writeCursor, (int) (writeCursor - readCursor), capacity, System.nanoTime());
        } finally {
            unlock();
        }
    }

    @Override
    public boolean validateInvariants() {
        RingSnapshot s = snapshot();
        long depth = s.writeCursor() - s.readCursor();
        return depth >= 0 && depth <= capacity;
    }

    @Override
    public RingStrategy strategy() {
        return RingStrategy.SPIN_LOCK;
    }

    private void lock() {
        // test-and-test-and-set: CAS only when the flag looks free
        while (locked.get() || !locked.compareAndSet(false, true)) {
            Thread.onSpinWait();
        }
    }

    private void unlock() {
        locked.set(false);
    }

    private int slotIndex(long cursor) {
        return (int) (cursor % capacity);
    }
}
