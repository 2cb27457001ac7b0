package com.acme.spsc.channel;

/**
 * How a spinning side waits between two retries of a full send or an empty recv.
 *
 * <p>Implementations must not park the thread or wait on a monitor: the peer never
 * signals, it only advances its cursor. A blocking variant would need a wake-up from
 * the peer on every cursor advance.</p>
 */
public interface IdleStrategy {

    /**
     * @param attempt number of consecutive failed retries before this one, starting at 0
     */
    void idle(int attempt);
}
