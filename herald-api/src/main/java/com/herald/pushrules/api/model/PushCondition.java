/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One condition of a push rule.
 *
 * @param kind       condition kind, e.g. {@code event_match}, {@code room_member_count}
 * @param parameters kind-specific parameters (pattern, key, is...)
 * @param cacheId    stable identifier shared by identical recipient-independent
 *                   conditions; null when the result must not be memoized
 */
public record PushCondition(String kind, Map<String, Object> parameters, String cacheId) {

    public static final String EVENT_MATCH = "event_match";
    public static final String ROOM_MEMBER_COUNT = "room_member_count";
    public static final String CONTAINS_DISPLAY_NAME = "contains_display_name";
    public static final String SENDER_NOTIFICATION_PERMISSION = "sender_notification_permission";

    public PushCondition {
        Objects.requireNonNull(kind, "kind");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static PushCondition of(String kind, Map<String, Object> parameters) {
        return new PushCondition(kind, parameters, null);
    }

    public Optional<String> memoKey() {
        return cacheId == null || cacheId.isEmpty() ? Optional.empty() : Optional.of(cacheId);
    }

    /**
     * Whether the outcome of this kind can differ between two recipients of the
     * same event.
     */
    public boolean dependsOnRecipient() {
        return CONTAINS_DISPLAY_NAME.equals(kind) || SENDER_NOTIFICATION_PERMISSION.equals(kind);
    }

    public Object parameter(String name) {
        return parameters.get(name);
    }
}
