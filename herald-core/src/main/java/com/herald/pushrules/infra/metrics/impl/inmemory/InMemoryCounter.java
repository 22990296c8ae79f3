/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics.impl.inmemory;

import com.herald.pushrules.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

/**
 * {@link LongAdder}-backed counter. Rejects negative amounts like the
 * Prometheus adapter does, so tests catch the same misuse.
 */
final class InMemoryCounter implements Counter {

    private final String name;
    private final LongAdder total = new LongAdder();

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Counter " + name + " cannot decrease by " + (-amount));
        }
        total.add(amount);
    }

    @Override
    public long count() {
        return total.sum();
    }

    @Override
    public String toString() {
        return name + "=" + count();
    }
}
