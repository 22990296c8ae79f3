/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.exceptions;

/**
 * Raised when the set of push rules for an event cannot be determined, usually
 * because a storage lookup failed.
 *
 * <p>
 * The outcome for the event is indeterminate: callers should retry the whole
 * evaluation later rather than assume that nobody is to be notified.
 */
public class RuleResolutionException extends RuntimeException {

    private final String roomId;

    public RuleResolutionException(String roomId, String message, Throwable cause) {
        super(message, cause);
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
