/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Objects;

/**
 * Identifies one piece of room state: an (event type, state key) pair.
 */
public record StateKey(String eventType, String stateKey) {

    public StateKey {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(stateKey, "stateKey");
    }

    public static StateKey member(String userId) {
        return new StateKey(EventTypes.MEMBER, userId);
    }

    public boolean isMembership() {
        return EventTypes.MEMBER.equals(eventType);
    }
}
