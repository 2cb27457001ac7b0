package com.acme.spsc.queue;

/**
 * Synchronization strategy of a ring. Both strategies honour the same
 * {@link BoundedRing} contract; a ring never mixes the two.
 */
public enum RingStrategy {
    /** Single-writer cursors published with release stores and read with acquire loads. */
    LOCK_FREE {
        @Override
        public <E> BoundedRing<E> newRing(int capacity) {
            return new LockFreeSpscRing<>(capacity);
        }
    },
    /** Cursor check, slot access and cursor update inside one busy-acquired critical section. */
    SPIN_LOCK {
        @Override
        public <E> BoundedRing<E> newRing(int capacity) {
            return new SpinLockSpscRing<>(capacity);
        }
    };

    public abstract <E> BoundedRing<E> newRing(int capacity);
}
