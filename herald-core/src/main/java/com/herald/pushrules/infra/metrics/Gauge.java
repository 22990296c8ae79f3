/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.infra.metrics;

/**
 * Last reported value of a size, such as the number of rooms with a warm rule
 * cache. Safe for concurrent use; the latest {@link #set} wins.
 */
public interface Gauge {

    void set(double value);

    double value();
}
