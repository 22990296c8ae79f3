/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.cache;

import com.herald.pushrules.api.exceptions.RuleResolutionException;
import com.herald.pushrules.api.model.MemberRecord;
import com.herald.pushrules.api.model.ResolutionContext;
import com.herald.pushrules.api.model.RuleSet;
import com.herald.pushrules.api.model.StateKey;
import com.herald.pushrules.api.spi.HomeserverUsers;
import com.herald.pushrules.api.spi.InvalidationCallback;
import com.herald.pushrules.api.spi.PushRuleStore;
import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.MetricsRegistry;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Push rules of the local members of one room, maintained incrementally as the
 * room's membership changes.
 *
 * <p>
 * The cache remembers which membership events it has already resolved and the
 * rule sets of the users behind them. A refresh for new room state only looks
 * up membership events it has not seen, so a join or leave costs one small
 * batched lookup instead of a full reload.
 *
 * <p>
 * <b>State token:</b> the state group of the last committed refresh. A context
 * carrying the same state group gets the answer committed with it, without any
 * lookup. A context without a state group never takes that path.
 *
 * <p>
 * <b>Generations:</b> {@link #invalidate()} bumps {@link #sequence()} and drops
 * everything. A refresh captures the sequence before its first lookup and only
 * commits if it is unchanged afterwards; otherwise its results are returned to
 * the caller but never stored, since they may predate the invalidation.
 *
 * <p>
 * <b>Thread Safety:</b> reading the cached maps, committing and invalidating
 * each happen inside a short {@code synchronized} section. No lock is held while
 * a store lookup is outstanding.
 */
public final class RoomRulesCache {

    private static final Logger logger = Logger.getLogger(RoomRulesCache.class.getName());

    private final String roomId;
    private final PushRuleStore store;
    private final HomeserverUsers users;
    private final InvalidationCallback invalidationCallback;

    private final Counter hits;
    private final Counter misses;
    private final Counter staleDiscards;
    private final Counter invalidations;

    // event id -> resolved membership
    private final Map<String, MemberRecord> memberMap = new HashMap<>();
    // rule sets of users resolved as joined, kept across state groups
    private final Map<String, RuleSet> rulesByUser = new HashMap<>();
    // answer committed for stateToken
    private Map<String, RuleSet> current = Map.of();
    private Object stateToken = new Object();
    private long sequence;

    /**
     * @param roomId               room this cache belongs to
     * @param store                storage lookups
     * @param users                local / application-service user checks
     * @param invalidationCallback registered with every store lookup; must not
     *                             hold a reference to this instance
     * @param metrics              metrics sink
     */
    public RoomRulesCache(String roomId,
                          PushRuleStore store,
                          HomeserverUsers users,
                          InvalidationCallback invalidationCallback,
                          MetricsRegistry metrics) {
        this.roomId = Objects.requireNonNull(roomId, "roomId must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.users = Objects.requireNonNull(users, "users must not be null");
        this.invalidationCallback = Objects.requireNonNull(invalidationCallback, "invalidationCallback must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        this.hits = metrics.counter("room_rules_cache_hits");
        this.misses = metrics.counter("room_rules_cache_misses");
        this.staleDiscards = metrics.counter("room_rules_stale_discards");
        this.invalidations = metrics.counter("room_rules_invalidations");
    }

    public String roomId() {
        return roomId;
    }

    /**
     * Returns the rule sets of the joined local members at the given room state.
     *
     * <p>
     * The returned future fails with {@link RuleResolutionException} if a store
     * lookup fails; nothing is cached in that case.
     *
     * @param context room state at the event
     * @return unmodifiable map of user id to rule set
     */
    public CompletableFuture<Map<String, RuleSet>> refresh(ResolutionContext context) {
        Objects.requireNonNull(context, "context must not be null");

        Map<String, RuleSet> reused = new HashMap<>();
        Map<String, String> missingEventIdsByUser = new HashMap<>();
        long startSequence;

        synchronized (this) {
            Object stateGroup = context.stateGroup();
            if (stateGroup != null && stateGroup.equals(stateToken)) {
                hits.increment();
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Room " + roomId + ": state group " + stateGroup + " is current, "
                            + current.size() + " joined users with rules");
                }
                return CompletableFuture.completedFuture(current);
            }

            startSequence = sequence;
            for (Map.Entry<StateKey, String> entry : context.currentStateIds().entrySet()) {
                String eventId = entry.getValue();
                MemberRecord known = memberMap.get(eventId);
                if (known != null) {
                    if (known.isJoined()) {
                        RuleSet rules = rulesByUser.get(known.userId());
                        if (rules != null) {
                            reused.put(known.userId(), rules);
                        }
                    }
                    continue;
                }

                StateKey key = entry.getKey();
                if (!key.isMembership()) {
                    continue;
                }
                String userId = key.stateKey();
                if (!users.isLocallyHomed(userId) || users.isApplicationServiceUser(userId)) {
                    continue;
                }
                missingEventIdsByUser.put(userId, eventId);
            }
        }

        misses.increment();
        if (missingEventIdsByUser.isEmpty()) {
            Map<String, RuleSet> result = Collections.unmodifiableMap(reused);
            commit(startSequence, List.of(), Map.of(), result, context.stateGroup());
            return CompletableFuture.completedFuture(result);
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Room " + roomId + ": reusing " + reused.size() + " rule sets, resolving "
                    + missingEventIdsByUser.size() + " membership events");
        }

        CompletableFuture<Map<String, RuleSet>> resolution;
        try {
            resolution = resolveMembers(missingEventIdsByUser.values())
                    .thenCompose(members -> fetchRules(members)
                            .thenApply(rules -> {
                                Map<String, RuleSet> joinedRules = joinedOnly(members, rules);
                                Map<String, RuleSet> result = new HashMap<>(reused);
                                result.putAll(joinedRules);
                                Map<String, RuleSet> answer = Collections.unmodifiableMap(result);
                                commit(startSequence, members, joinedRules, answer, context.stateGroup());
                                return answer;
                            }));
        } catch (RuntimeException e) {
            resolution = CompletableFuture.failedFuture(e);
        }

        return resolution.handle((result, error) -> {
            if (error != null) {
                throw resolutionFailure(error);
            }
            return result;
        });
    }

    private CompletableFuture<List<MemberRecord>> resolveMembers(Collection<String> eventIds) {
        return store.getMembershipsForEventIds(List.copyOf(eventIds))
                .thenApply(rows -> rows == null ? List.<MemberRecord>of() : rows);
    }

    /**
     * Rules of the resolved members that have a pusher. Read receipts only
     * count for users already qualified by a pusher; the receipt lookup is made
     * so that a new receipt invalidates the room. Rule sets that come back null
     * are dropped.
     */
    private CompletableFuture<Map<String, RuleSet>> fetchRules(List<MemberRecord> members) {
        Set<String> interested = new HashSet<>();
        for (MemberRecord member : members) {
            interested.add(member.userId());
        }
        if (interested.isEmpty()) {
            return CompletableFuture.completedFuture(Map.of());
        }

        CompletableFuture<Map<String, Boolean>> pushers = store.usersHavePushers(interested, invalidationCallback);
        CompletableFuture<Set<String>> receipts = store.getUsersWithReadReceiptsInRoom(roomId, invalidationCallback);

        return pushers.thenCombine(receipts, (havePushers, withReceipts) -> {
            Set<String> withPusher = new HashSet<>();
            if (havePushers != null) {
                havePushers.forEach((userId, hasPusher) -> {
                    if (Boolean.TRUE.equals(hasPusher) && interested.contains(userId)) {
                        withPusher.add(userId);
                    }
                });
            }
            Set<String> toFetch = new HashSet<>(withPusher);
            if (withReceipts != null) {
                for (String userId : withReceipts) {
                    if (withPusher.contains(userId)) {
                        toFetch.add(userId);
                    }
                }
            }
            return toFetch;
        }).thenCompose(toFetch -> {
            if (toFetch.isEmpty()) {
                return CompletableFuture.completedFuture(Map.<String, RuleSet>of());
            }
            return store.bulkGetPushRules(toFetch, invalidationCallback).thenApply(fetched -> {
                Map<String, RuleSet> rules = new HashMap<>();
                if (fetched != null) {
                    fetched.forEach((userId, ruleSet) -> {
                        if (ruleSet != null) {
                            rules.put(userId, ruleSet);
                        }
                    });
                }
                return rules;
            });
        });
    }

    private static Map<String, RuleSet> joinedOnly(List<MemberRecord> members, Map<String, RuleSet> rules) {
        Map<String, RuleSet> joined = new HashMap<>();
        for (MemberRecord member : members) {
            RuleSet memberRules = rules.get(member.userId());
            if (member.isJoined() && memberRules != null) {
                joined.put(member.userId(), memberRules);
            }
        }
        return joined;
    }

    /**
     * @param rules  rules of the newly resolved members that are joined
     * @param answer what this refresh returns, served again for the same state group
     */
    private synchronized void commit(long startSequence,
                                     List<MemberRecord> members,
                                     Map<String, RuleSet> rules,
                                     Map<String, RuleSet> answer,
                                     Object stateGroup) {
        if (startSequence != sequence) {
            staleDiscards.increment();
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Room " + roomId + ": discarding refresh from generation " + startSequence
                        + ", cache is now at generation " + sequence);
            }
            return;
        }
        for (MemberRecord member : members) {
            memberMap.put(member.eventId(), member);
        }
        rulesByUser.putAll(rules);
        current = answer;
        stateToken = stateGroup != null ? stateGroup : new Object();
    }

    private RuleResolutionException resolutionFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RuleResolutionException rre) {
            return rre;
        }
        return new RuleResolutionException(roomId, "Could not resolve push rules for room " + roomId, cause);
    }

    /**
     * Drops all cached members and rules and starts a new generation. In-flight
     * refreshes will not commit.
     */
    public synchronized void invalidate() {
        sequence++;
        stateToken = new Object();
        memberMap.clear();
        rulesByUser.clear();
        current = Map.of();
        invalidations.increment();
        logger.fine("Room " + roomId + ": invalidated, generation " + sequence);
    }

    public synchronized long sequence() {
        return sequence;
    }

    /**
     * @return true if a refresh with this state group would be answered from memory
     */
    public synchronized boolean isCurrentFor(Object stateGroup) {
        return stateGroup != null && stateGroup.equals(stateToken);
    }

    /**
     * @return true if any resolved membership event of this room belongs to the user
     */
    public synchronized boolean hasMember(String userId) {
        for (MemberRecord member : memberMap.values()) {
            if (member.userId().equals(userId)) {
                return true;
            }
        }
        return false;
    }

    public synchronized boolean hasRulesFor(String userId) {
        return rulesByUser.containsKey(userId);
    }

    public synchronized int cachedUserCount() {
        return rulesByUser.size();
    }

    public synchronized int cachedMemberCount() {
        return memberMap.size();
    }

    @Override
    public synchronized String toString() {
        return "RoomRulesCache{roomId=" + roomId + ", generation=" + sequence
                + ", members=" + memberMap.size() + ", users=" + rulesByUser.size() + "}";
    }
}
