/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

import com.herald.pushrules.api.model.Event;
import com.herald.pushrules.api.model.ProfileInfo;
import com.herald.pushrules.api.model.ResolutionContext;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves the joined members of a room at a given event.
 */
public interface RoomMemberDirectory {

    CompletableFuture<Map<String, ProfileInfo>> getJoinedMembersWithProfiles(Event event, ResolutionContext context);
}
