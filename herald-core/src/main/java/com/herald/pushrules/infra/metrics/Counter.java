/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics;

/**
 * Count of push pipeline occurrences, such as cache hits or notifications
 * sent. Never decreases; implementations are safe for concurrent use.
 */
public interface Counter {

    default void increment() {
        increment(1L);
    }

    /**
     * @param amount non-negative; a batch of notifications counts as its size
     */
    void increment(long amount);

    long count();
}
