package com.acme.spsc.queue;

public record RingSnapshot(
    long readCursor,
    long writeCursor,
    int depth,
    int capacity,
    long tsNanos
) {}
