/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

/**
 * Hook handed to a store lookup so that a later change of the looked-up data
 * (pusher added or removed, receipt written, rules edited) can invalidate the
 * caller's derived state.
 *
 * <p>
 * Stores may register the same callback any number of times; invoking it more
 * than once must be harmless.
 */
@FunctionalInterface
public interface InvalidationCallback {

    void invalidate();
}
