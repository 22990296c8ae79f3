/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

/**
 * Values of the {@code membership} field of an {@code m.room.member} event.
 */
public final class Membership {

    public static final String JOIN = "join";
    public static final String INVITE = "invite";
    public static final String LEAVE = "leave";
    public static final String BAN = "ban";
    public static final String KNOCK = "knock";

    private Membership() {
        throw new AssertionError("No instances");
    }
}
