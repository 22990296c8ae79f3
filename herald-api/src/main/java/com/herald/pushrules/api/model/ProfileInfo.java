/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

/**
 * Per-room profile of a joined member.
 */
public record ProfileInfo(String displayName, String avatarUrl) {

    public static ProfileInfo named(String displayName) {
        return new ProfileInfo(displayName, null);
    }
}
