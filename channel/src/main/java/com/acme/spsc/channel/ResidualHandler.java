package com.acme.spsc.channel;

/**
 * Receives every value that was sent but never received, exactly once, when the
 * channel tears down. Values handed out by {@code recv} never reach it.
 *
 * <p>Use it to release payloads that own resources (buffers, leases, file handles).
 * It runs on whichever thread closes the handle that triggers the drain.</p>
 */
@FunctionalInterface
public interface ResidualHandler<T> {

    void release(T value);

    static <T> ResidualHandler<T> discard() {
        return value -> {
        };
    }
}
