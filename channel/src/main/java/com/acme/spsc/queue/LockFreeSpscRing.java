package com.acme.spsc.queue;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;

/**
 * Lock-free bounded single-producer single-consumer ring.
 *
 * <p>Each cursor has exactly one writer, so no CAS is needed. The owner reads its own
 * cursor with opaque access and publishes the next value with a release store; the peer
 * reads it with an acquire load. That pairing gives the two orderings the protocol
 * relies on:</p>
 * <ul>
 *   <li>the producer's slot store happens-before the consumer observes the advanced
 *       write cursor, so a visible slot is never stale;</li>
 *   <li>the consumer's slot load and clear happen-before the producer observes the
 *       advanced read cursor, so a slot is never overwritten before it is read.</li>
 * </ul>
 *
 * <p>Each side keeps a private copy of the peer's cursor and refreshes it only when the
 * ring looks full (producer) or empty (consumer).</p>
 *
 * <p><b>Contract:</b> {@link #offer(Object)} from one producer thread only,
 * {@link #poll()} and {@link #drain} from one consumer thread only. Handing a side over
 * to another thread requires a happens-before edge between the two threads.</p>
 */
public final class LockFreeSpscRing<E> implements BoundedRing<E> {

    private static final VarHandle WRITE_CURSOR;
    private static final VarHandle READ_CURSOR;

    static {
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            WRITE_CURSOR = lookup.findVarHandle(LockFreeSpscRing.class, "writeCursor", long.class);
            READ_CURSOR = lookup.findVarHandle(LockFreeSpscRing.class, "readCursor", long.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final Object[] buffer;
    private final int capacity;

    // ---- cache-line padding before the producer's fields ----
    @SuppressWarnings("unused")
    private long p00, p01, p02, p03, p04, p05, p06, p07;

    private volatile long writeCursor;
    // producer-local view of readCursor
    private long cachedReadCursor;

    // ---- cache-line padding between producer and consumer fields ----
    @SuppressWarnings("unused")
    private long p10, p11, p12, p13, p14, p15, p16, p17;

    private volatile long readCursor;
    // consumer-local view of writeCursor
    private long cachedWriteCursor;

    @SuppressWarnings("unused")
    private long p20, p21, p22, p23, p24, p25, p26, p27;

    public LockFreeSpscRing(int capacity) {
        this.capacity = BoundedRing.checkCapacity(capacity);
        this.buffer = new Object[capacity];
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public int sizeApprox() {
        return snapshot().depth();
    }

    @Override
    public OfferResult offer(E e) {
        Objects.requireNonNull(e, "e");
        long pos = (long) WRITE_CURSOR.getOpaque(this);

        if (pos - cachedReadCursor >= capacity) {
            cachedReadCursor = (long) READ_CURSOR.getAcquire(this);
            if (pos - cachedReadCursor >= capacity) {
                return new OfferResult.Full((int) (pos - cachedReadCursor), capacity);
            }
        }

        int slot = slotIndex(pos);
        if (buffer[slot] != null) {
            throw new IllegalStateException("Slot " + slot + " still occupied at write cursor " + pos);
        }
        buffer[slot] = e;
        // publishes the slot store above
        WRITE_CURSOR.setRelease(this, pos + 1);
        return new OfferResult.Ok(pos);
    }

    @Override
    @SuppressWarnings("unchecked")
    public E poll() {
        long pos = (long) READ_CURSOR.getOpaque(this);

        if (pos >= cachedWriteCursor) {
            cachedWriteCursor = (long) WRITE_CURSOR.getAcquire(this);
            if (pos >= cachedWriteCursor) {
                return null;
            }
        }

        int slot = slotIndex(pos);
        E value = (E) buffer[slot];
        if (value == null) {
            throw new IllegalStateException("Slot " + slot + " empty below write cursor " + cachedWriteCursor);
        }
        buffer[slot] = null;
        // frees the slot only after the load and clear above
        READ_CURSOR.setRelease(this, pos + 1);
        return value;
    }

    @Override
    public long writeCursor() {
        return (long) WRITE_CURSOR.getAcquire(this);
    }

    @Override
    public long readCursor() {
        return (long) READ_CURSOR.getAcquire(this);
    }

    @Override
    public RingStrategy strategy() {
        return RingStrategy.LOCK_FREE;
    }

    private int slotIndex(long cursor) {
        return (int) (cursor % capacity);
    }
}
