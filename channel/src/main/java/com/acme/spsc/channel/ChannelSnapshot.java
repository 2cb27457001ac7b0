package com.acme.spsc.channel;

import com.acme.spsc.queue.RingStrategy;

public record ChannelSnapshot(
    String name,
    RingStrategy strategy,
    int capacity,
    int depth,
    long readCursor,
    long writeCursor,
    boolean producerLive,
    boolean consumerLive,
    long tsNanos
) {}
