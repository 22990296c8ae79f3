/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.runtime.evaluation;

import com.herald.pushrules.api.IBulkPushRuleEvaluator;
import com.herald.pushrules.api.exceptions.RuleResolutionException;
import com.herald.pushrules.api.model.Event;
import com.herald.pushrules.api.model.Membership;
import com.herald.pushrules.api.model.ProfileInfo;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.Recipient;
import com.herald.pushrules.api.model.ResolutionContext;
import com.herald.pushrules.api.model.RuleSet;
import com.herald.pushrules.api.spi.ConditionMatcherFactory;
import com.herald.pushrules.api.spi.EventVisibilityFilter;
import com.herald.pushrules.api.spi.HomeserverUsers;
import com.herald.pushrules.api.spi.PushRuleStore;
import com.herald.pushrules.api.spi.RoomMemberDirectory;
import com.herald.pushrules.cache.RoomRulesCacheRegistry;
import com.herald.pushrules.infra.config.PushRulesConfig;
import com.herald.pushrules.infra.metrics.Counter;
import com.herald.pushrules.infra.metrics.MetricsRegistry;
import com.herald.pushrules.infra.telemetry.TracingService;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides, for one event, which users of the room get a push notification and
 * with which actions.
 *
 * <p>
 * <b>Pipeline:</b>
 * <ol>
 * <li>candidate rule sets from the room's {@link com.herald.pushrules.cache.RoomRulesCache}</li>
 * <li>an invited local user with a pusher is added for this event only</li>
 * <li>users who cannot see the event are dropped, as is the sender</li>
 * <li>each remaining user's rules run in order; the first match decides</li>
 * </ol>
 *
 * <p>
 * Conditions that do not depend on the recipient are evaluated at most once
 * per event (see {@link ConditionMemo}).
 *
 * <p>
 * <b>Failures:</b> if any lookup fails the returned future fails with
 * {@link RuleResolutionException}; no partial result is produced. Malformed
 * rules are skipped and never fail the evaluation.
 */
public class BulkPushRuleEvaluator implements IBulkPushRuleEvaluator {

    private static final Logger logger = Logger.getLogger(BulkPushRuleEvaluator.class.getName());

    private final RoomRulesCacheRegistry registry;
    private final PushRuleStore store;
    private final HomeserverUsers users;
    private final EventVisibilityFilter visibilityFilter;
    private final RoomMemberDirectory memberDirectory;
    private final ConditionMatcherFactory matcherFactory;
    private final Tracer tracer;

    private final Counter evaluations;
    private final Counter notifications;
    private final Counter malformedRules;
    private final Counter failures;

    public BulkPushRuleEvaluator(RoomRulesCacheRegistry registry,
                                 PushRuleStore store,
                                 HomeserverUsers users,
                                 EventVisibilityFilter visibilityFilter,
                                 RoomMemberDirectory memberDirectory,
                                 ConditionMatcherFactory matcherFactory,
                                 Tracer tracer,
                                 MetricsRegistry metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.users = Objects.requireNonNull(users, "users must not be null");
        this.visibilityFilter = Objects.requireNonNull(visibilityFilter, "visibilityFilter must not be null");
        this.memberDirectory = Objects.requireNonNull(memberDirectory, "memberDirectory must not be null");
        this.matcherFactory = Objects.requireNonNull(matcherFactory, "matcherFactory must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        Objects.requireNonNull(metrics, "metrics must not be null");
        this.evaluations = metrics.counter("push_rules_evaluations");
        this.notifications = metrics.counter("push_rules_notifications");
        this.malformedRules = metrics.counter("push_rules_malformed");
        this.failures = metrics.counter("push_rules_evaluation_failures");

        logger.info("BulkPushRuleEvaluator initialized");
    }

    /**
     * Wires an evaluator with its own room cache registry, the process-wide
     * metrics registry and, if enabled in the configuration, the process-wide
     * tracer.
     */
    public static BulkPushRuleEvaluator create(PushRulesConfig config,
                                               PushRuleStore store,
                                               HomeserverUsers users,
                                               EventVisibilityFilter visibilityFilter,
                                               RoomMemberDirectory memberDirectory,
                                               ConditionMatcherFactory matcherFactory) {
        Objects.requireNonNull(config, "config must not be null");
        MetricsRegistry metrics = MetricsRegistry.getInstance();
        TracingService tracing = config.tracingEnabled() ? TracingService.getInstance() : TracingService.disabled();
        RoomRulesCacheRegistry registry = new RoomRulesCacheRegistry(config, store, users, metrics);
        return new BulkPushRuleEvaluator(registry, store, users, visibilityFilter, memberDirectory,
                matcherFactory, tracing.getTracer(), metrics);
    }

    /**
     * Registry of per-room caches; rule and membership changes are reported here.
     */
    public RoomRulesCacheRegistry registry() {
        return registry;
    }

    @Override
    public CompletableFuture<Map<String, List<PushAction>>> evaluate(Event event, ResolutionContext context) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Span span = tracer.spanBuilder("bulk-push-evaluate").startSpan();
        span.setAttribute("eventId", event.eventId());
        span.setAttribute("roomId", event.roomId());
        evaluations.increment();

        CompletableFuture<Map<String, List<PushAction>>> outcome;
        try {
            outcome = registry.getOrCreate(event.roomId())
                    .refresh(context)
                    .thenCompose(rules -> withInvitee(event, rules))
                    .thenCompose(rules -> {
                        span.setAttribute("candidateCount", rules.size());
                        if (rules.isEmpty()) {
                            return CompletableFuture.completedFuture(Map.<String, List<PushAction>>of());
                        }
                        return actionsByUser(event, context, rules);
                    });
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }

        return outcome.handle((actions, error) -> {
            try {
                if (error != null) {
                    RuleResolutionException failure = resolutionFailure(event, error);
                    failures.increment();
                    span.recordException(failure);
                    span.setStatus(StatusCode.ERROR, failure.getMessage());
                    logger.log(Level.WARNING, "Push rule evaluation failed for event " + event.eventId()
                            + " in room " + event.roomId(), failure);
                    throw failure;
                }
                span.setAttribute("notifiedCount", actions.size());
                notifications.increment(actions.size());
                return actions;
            } finally {
                span.end();
            }
        });
    }

    /**
     * An invite must reach the invitee even though they are not a member yet.
     * Their rules are added to a copy; the room cache never sees them.
     */
    private CompletableFuture<Map<String, RuleSet>> withInvitee(Event event, Map<String, RuleSet> rules) {
        if (!event.isMembershipEvent() || !Membership.INVITE.equals(event.membership())) {
            return CompletableFuture.completedFuture(rules);
        }
        String invitee = event.stateKey();
        if (invitee == null || invitee.isEmpty() || rules.containsKey(invitee) || !users.isLocallyHomed(invitee)) {
            return CompletableFuture.completedFuture(rules);
        }

        return store.userHasPusher(invitee).thenCompose(hasPusher -> {
            if (!Boolean.TRUE.equals(hasPusher)) {
                return CompletableFuture.completedFuture(rules);
            }
            return store.getPushRulesForUser(invitee).thenApply(inviteeRules -> {
                if (inviteeRules == null) {
                    return rules;
                }
                Map<String, RuleSet> withInvitee = new HashMap<>(rules);
                withInvitee.put(invitee, inviteeRules);
                return Collections.unmodifiableMap(withInvitee);
            });
        });
    }

    private CompletableFuture<Map<String, List<PushAction>>> actionsByUser(Event event,
                                                                           ResolutionContext context,
                                                                           Map<String, RuleSet> rulesByUser) {
        // candidates come from room membership, so nobody is peeking
        List<Recipient> recipients = new ArrayList<>(rulesByUser.size());
        for (String userId : rulesByUser.keySet()) {
            recipients.add(Recipient.member(userId));
        }

        return visibilityFilter.filterEventsForRecipients(recipients, List.of(event), Map.of(event.eventId(), context))
                .thenCompose(visible -> memberDirectory.getJoinedMembersWithProfiles(event, context)
                        .thenApply(members -> evaluateRules(event, rulesByUser, visible, members)));
    }

    private Map<String, List<PushAction>> evaluateRules(Event event,
                                                        Map<String, RuleSet> rulesByUser,
                                                        Map<String, List<Event>> visible,
                                                        Map<String, ProfileInfo> members) {
        Map<String, ProfileInfo> profiles = members != null ? members : Map.of();
        logger.fine("Room " + event.roomId() + ": " + profiles.size() + " joined members, "
                + rulesByUser.size() + " candidates for " + event.eventId());

        PushRuleListEvaluator ruleEvaluator = new PushRuleListEvaluator(
                matcherFactory.forEvent(event, profiles.size()), new ConditionMemo(), malformedRules);

        Map<String, List<PushAction>> actionsByUser = new LinkedHashMap<>();
        for (Map.Entry<String, RuleSet> entry : rulesByUser.entrySet()) {
            String userId = entry.getKey();

            List<Event> visibleEvents = visible != null ? visible.get(userId) : null;
            if (visibleEvents == null || visibleEvents.isEmpty()) {
                continue;
            }
            if (event.sender().equals(userId)) {
                continue;
            }

            List<PushAction> actions = ruleEvaluator.actionsFor(userId, displayNameOf(event, userId, profiles), entry.getValue());
            if (!actions.isEmpty()) {
                actionsByUser.put(userId, actions);
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Event " + event.eventId() + " notifies " + actionsByUser.keySet());
        }
        return Collections.unmodifiableMap(actionsByUser);
    }

    /**
     * Room profile name; for the target of a membership event that is not
     * joined yet, the name proposed by the event itself.
     */
    private static String displayNameOf(Event event, String userId, Map<String, ProfileInfo> profiles) {
        ProfileInfo profile = profiles.get(userId);
        String displayName = profile != null ? profile.displayName() : null;
        if ((displayName == null || displayName.isEmpty())
                && event.isMembershipEvent() && userId.equals(event.stateKey())) {
            displayName = event.proposedDisplayName();
        }
        return displayName;
    }

    private static RuleResolutionException resolutionFailure(Event event, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof RuleResolutionException rre) {
            return rre;
        }
        return new RuleResolutionException(event.roomId(),
                "Could not evaluate push rules for event " + event.eventId(), cause);
    }
}
