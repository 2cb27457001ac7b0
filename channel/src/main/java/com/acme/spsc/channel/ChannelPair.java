package com.acme.spsc.channel;

import java.util.Objects;

/**
 * The two handles of one channel, as returned by {@link SpscChannel#open}.
 *
 * <p>Closing the pair closes both handles, consumer first. Meant for the thread that
 * opened the channel and still holds both ends; once the handles are given to their
 * threads, each thread closes its own.</p>
 */
public record ChannelPair<T>(Producer<T> producer, Consumer<T> consumer) implements AutoCloseable {

    public ChannelPair {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
    }

    @Override
    public void close() {
        consumer.close();
        producer.close();
    }
}
