package com.acme.spsc.channel;

/**
 * Outcome of {@link Producer#send(Object)}.
 *
 * <p>{@link SendError} means no consumer can ever receive the value; it is handed back
 * untouched so the caller can dispose of it or route it elsewhere.</p>
 */
public sealed interface SendResult<T> permits SendResult.Sent, SendResult.SendError {

    record Sent<T>() implements SendResult<T> {
        private static final Sent<?> INSTANCE = new Sent<>();
    }

    record SendError<T>(T value) implements SendResult<T> {}

    @SuppressWarnings("unchecked")
    static <T> SendResult<T> sent() {
        return (SendResult<T>) Sent.INSTANCE;
    }

    default boolean isSent() {
        return this instanceof Sent<?>;
    }
}
