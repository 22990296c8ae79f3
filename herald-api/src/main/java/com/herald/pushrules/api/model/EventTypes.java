/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

/**
 * Room event types the push pipeline inspects.
 */
public final class EventTypes {

    public static final String MEMBER = "m.room.member";
    public static final String MESSAGE = "m.room.message";

    private EventTypes() {
        throw new AssertionError("No instances");
    }
}
