/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.herald.pushrules.api.spi.HomeserverUsers;
import com.herald.pushrules.api.spi.InvalidationCallback;
import com.herald.pushrules.api.spi.PushRuleStore;
import com.herald.pushrules.infra.config.PushRulesConfig;
import com.herald.pushrules.infra.metrics.Gauge;
import com.herald.pushrules.infra.metrics.MetricsRegistry;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Logger;

/**
 * Bounded map of room id to {@link RoomRulesCache}, backed by Caffeine.
 *
 * <p>
 * Entries are created on first use and evicted by Caffeine's size-based policy
 * (W-TinyLFU). Eviction only loses warm state: the next {@link #getOrCreate}
 * for that room builds a cold cache, and a refresh still running on the
 * evicted entry completes normally against it.
 *
 * <p>
 * Store lookups never get a reference to an entry. They get the callback from
 * {@link #invalidationCallback(String)}, which resolves the room id through
 * this registry when fired, so a store holding callbacks for a long time does
 * not keep evicted entries alive.
 *
 * <p>
 * <b>Usage Example:</b>
 * <pre>{@code
 * RoomRulesCacheRegistry registry = new RoomRulesCacheRegistry(
 *     PushRulesConfig.loadDefault(), store, users, MetricsRegistry.getInstance());
 *
 * registry.getOrCreate("!room:example.org").refresh(context)
 *     .thenAccept(rulesByUser -> ...);
 *
 * // a user edited their rules
 * registry.onRulesChanged("@alice:example.org");
 * }</pre>
 */
public class RoomRulesCacheRegistry {

    private static final Logger logger = Logger.getLogger(RoomRulesCacheRegistry.class.getName());

    private final Cache<String, RoomRulesCache> rooms;
    private final PushRuleStore store;
    private final HomeserverUsers users;
    private final MetricsRegistry metrics;
    private final Gauge sizeGauge;

    public RoomRulesCacheRegistry(PushRulesConfig config,
                                  PushRuleStore store,
                                  HomeserverUsers users,
                                  MetricsRegistry metrics) {
        this(config, store, users, metrics, ForkJoinPool.commonPool());
    }

    /**
     * @param executor runs Caffeine maintenance and removal notifications;
     *                 {@code Runnable::run} makes eviction synchronous
     */
    public RoomRulesCacheRegistry(PushRulesConfig config,
                                  PushRuleStore store,
                                  HomeserverUsers users,
                                  MetricsRegistry metrics,
                                  Executor executor) {
        Objects.requireNonNull(config, "config must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.users = Objects.requireNonNull(users, "users must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        Objects.requireNonNull(executor, "executor must not be null");
        this.sizeGauge = metrics.gauge("room_rules_cache_size");

        boolean logEvictions = config.logEvictions();
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.roomCacheMaxSize())
                .executor(executor);
        if (config.recordStats()) {
            builder.recordStats();
        }
        this.rooms = builder
                .removalListener((String roomId, RoomRulesCache cache, RemovalCause cause) -> {
                    if (logEvictions && cause.wasEvicted()) {
                        logger.info("Evicted push rule cache of room " + roomId + " (" + cause + ")");
                    }
                })
                .build();

        logger.info("RoomRulesCacheRegistry initialized: maxSize=" + config.roomCacheMaxSize()
                + ", recordStats=" + config.recordStats());
    }

    /**
     * @return the room's cache, created empty if absent
     */
    public RoomRulesCache getOrCreate(String roomId) {
        Objects.requireNonNull(roomId, "roomId must not be null");
        RoomRulesCache cache = rooms.get(roomId,
                id -> new RoomRulesCache(id, store, users, invalidationCallback(id), metrics));
        sizeGauge.set(rooms.estimatedSize());
        return cache;
    }

    /**
     * Callback that invalidates the room's entry if one is present when it
     * fires. It does not create entries and does not count as a cache access.
     */
    public InvalidationCallback invalidationCallback(String roomId) {
        Objects.requireNonNull(roomId, "roomId must not be null");
        return () -> invalidateRoom(roomId);
    }

    public void invalidateRoom(String roomId) {
        RoomRulesCache cache = rooms.policy().getIfPresentQuietly(roomId);
        if (cache != null) {
            cache.invalidate();
        }
    }

    /**
     * Invalidates every room in which the user has a resolved membership,
     * whether or not rules were cached for them.
     *
     * @return number of rooms invalidated
     */
    public int onRulesChanged(String userId) {
        Objects.requireNonNull(userId, "userId must not be null");
        int invalidated = 0;
        for (RoomRulesCache cache : rooms.asMap().values()) {
            if (cache.hasMember(userId)) {
                cache.invalidate();
                invalidated++;
            }
        }
        logger.fine("Rules of " + userId + " changed, invalidated " + invalidated + " rooms");
        return invalidated;
    }

    public Optional<RoomRulesCache> peek(String roomId) {
        return Optional.ofNullable(rooms.policy().getIfPresentQuietly(roomId));
    }

    public void evict(String roomId) {
        rooms.invalidate(roomId);
        sizeGauge.set(rooms.estimatedSize());
    }

    public void evictAll() {
        rooms.invalidateAll();
        sizeGauge.set(rooms.estimatedSize());
    }

    public long estimatedSize() {
        return rooms.estimatedSize();
    }

    /**
     * Runs pending Caffeine maintenance, including size-based eviction.
     */
    public void cleanUp() {
        rooms.cleanUp();
        sizeGauge.set(rooms.estimatedSize());
    }

    public CacheStats stats() {
        return rooms.stats();
    }
}
