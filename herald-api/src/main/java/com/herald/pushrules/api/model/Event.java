/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable room event as seen by the push pipeline.
 *
 * <p>
 * An event consists of:
 * <ul>
 * <li><b>eventId</b>: globally unique identifier.</li>
 * <li><b>roomId</b>: the room the event was sent to.</li>
 * <li><b>type</b>: event type, e.g. {@code m.room.message}.</li>
 * <li><b>sender</b>: user id of the sender.</li>
 * <li><b>stateKey</b>: present only on state events; for membership events it
 * is the user id whose membership changes.</li>
 * <li><b>content</b>: the event payload.</li>
 * </ul>
 *
 * @param eventId  unique identifier (must not be null)
 * @param roomId   room identifier (must not be null)
 * @param type     event type (must not be null)
 * @param sender   sender user id (must not be null)
 * @param stateKey state key, or {@code null} for non-state events
 * @param content  event content; copied, never null, values may be null
 */
public record Event(
        String eventId,
        String roomId,
        String type,
        String sender,
        String stateKey,
        Map<String, Object> content) {

    public Event {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(roomId, "roomId");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(sender, "sender");
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public boolean isStateEvent() {
        return stateKey != null;
    }

    public boolean isMembershipEvent() {
        return EventTypes.MEMBER.equals(type);
    }

    /**
     * @return the {@code membership} content field of a membership event, or {@code null}
     */
    public String membership() {
        Object value = content.get("membership");
        return value instanceof String s ? s : null;
    }

    /**
     * @return the {@code displayname} proposed by a membership event, or {@code null}
     */
    public String proposedDisplayName() {
        Object value = content.get("displayname");
        return value instanceof String s ? s : null;
    }
}
