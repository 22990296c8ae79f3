/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Objects;

/**
 * A resolved membership: the membership event and the state it established.
 *
 * @param eventId    id of the membership event
 * @param userId     member user id
 * @param membership membership state, see {@link Membership}
 */
public record MemberRecord(String eventId, String userId, String membership) {

    public MemberRecord {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(userId, "userId");
    }

    public boolean isJoined() {
        return Membership.JOIN.equals(membership);
    }
}
