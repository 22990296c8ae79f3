/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

/**
 * A candidate reader of an event, as passed to the visibility filter.
 *
 * @param userId  the user
 * @param peeking true if the user reads the room without being a member
 */
public record Recipient(String userId, boolean peeking) {

    public static Recipient member(String userId) {
        return new Recipient(userId, false);
    }
}
