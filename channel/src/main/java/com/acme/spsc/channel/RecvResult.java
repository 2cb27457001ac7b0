package com.acme.spsc.channel;

/**
 * Outcome of {@link Consumer#recv()}.
 *
 * <p>{@link RecvError} means the producer is gone and the ring is drained. The state
 * is permanent: every later {@code recv} on the same consumer returns it again.</p>
 */
public sealed interface RecvResult<T> permits RecvResult.Received, RecvResult.RecvError {

    record Received<T>(T value) implements RecvResult<T> {}

    record RecvError<T>() implements RecvResult<T> {
        private static final RecvError<?> INSTANCE = new RecvError<>();
    }

    @SuppressWarnings("unchecked")
    static <T> RecvResult<T> closed() {
        return (RecvResult<T>) RecvError.INSTANCE;
    }

    default boolean isReceived() {
        return this instanceof Received<?>;
    }
}
