/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

import com.herald.pushrules.api.model.MemberRecord;
import com.herald.pushrules.api.model.RuleSet;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Storage lookups needed to decide who gets push notifications.
 *
 * <p>
 * Every method is asynchronous. A failed lookup completes the returned future
 * exceptionally; callers must not read a failure as "no data".
 *
 * <p>
 * Methods taking an {@link InvalidationCallback} register it against the rows
 * they read and invoke it whenever those rows later change.
 */
public interface PushRuleStore {

    /**
     * Resolves membership events in one batched read.
     *
     * @param eventIds membership event ids
     * @return one record per event id found
     */
    CompletableFuture<List<MemberRecord>> getMembershipsForEventIds(Collection<String> eventIds);

    CompletableFuture<Boolean> userHasPusher(String userId);

    /**
     * @return for each requested user, whether at least one pusher is registered
     */
    CompletableFuture<Map<String, Boolean>> usersHavePushers(Set<String> userIds, InvalidationCallback onInvalidate);

    /**
     * @return users that have left a read receipt in the room
     */
    CompletableFuture<Set<String>> getUsersWithReadReceiptsInRoom(String roomId, InvalidationCallback onInvalidate);

    /**
     * Fetches the rule sets of many users at once. Users without rules map to
     * {@code null} or are missing from the result.
     */
    CompletableFuture<Map<String, RuleSet>> bulkGetPushRules(Set<String> userIds, InvalidationCallback onInvalidate);

    /**
     * @return the user's rule set, or a future of {@code null} if the user has none
     */
    CompletableFuture<RuleSet> getPushRulesForUser(String userId);
}
