package com.acme.spsc.queue;

public sealed interface OfferResult permits OfferResult.Ok, OfferResult.Full {
    record Ok(long cursor) implements OfferResult {}
    record Full(int depth, int capacity) implements OfferResult {}
}
