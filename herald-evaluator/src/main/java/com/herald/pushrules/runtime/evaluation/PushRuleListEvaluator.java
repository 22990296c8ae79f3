/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.runtime.evaluation;

import com.herald.pushrules.api.exceptions.MalformedRuleException;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.PushRule;
import com.herald.pushrules.api.model.RuleSet;
import com.herald.pushrules.api.spi.ConditionMatcher;
import com.herald.pushrules.infra.metrics.Counter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one user's ordered rule list against the event bound to the matcher.
 *
 * <p>
 * The first enabled, well-formed rule whose conditions all hold decides the
 * outcome; later rules are not looked at. {@code dont_notify} is removed from
 * its actions and the rest is kept only if it still contains {@code notify}.
 */
public final class PushRuleListEvaluator {

    private static final Logger logger = Logger.getLogger(PushRuleListEvaluator.class.getName());

    private final ConditionMatcher matcher;
    private final ConditionMemo memo;
    private final Counter malformedRules;

    public PushRuleListEvaluator(ConditionMatcher matcher, ConditionMemo memo, Counter malformedRules) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.memo = Objects.requireNonNull(memo, "memo must not be null");
        this.malformedRules = Objects.requireNonNull(malformedRules, "malformedRules must not be null");
    }

    /**
     * @param userId      recipient
     * @param displayName recipient's display name, may be null
     * @param rules       recipient's rules, highest priority first
     * @return notification actions, or an empty list if the user is not notified
     */
    public List<PushAction> actionsFor(String userId, String displayName, RuleSet rules) {
        for (PushRule rule : rules) {
            if (!rule.enabled()) {
                continue;
            }
            if (!rule.isWellFormed()) {
                reportMalformed(userId, rule, "missing conditions or actions");
                continue;
            }

            boolean matched;
            try {
                matched = memo.allMatch(rule.conditions(), matcher, userId, displayName);
            } catch (MalformedRuleException e) {
                reportMalformed(userId, rule, e.getMessage());
                continue;
            }
            if (matched) {
                return notifyingActions(rule.actions());
            }
        }
        return List.of();
    }

    private static List<PushAction> notifyingActions(List<PushAction> actions) {
        List<PushAction> kept = new ArrayList<>(actions.size());
        boolean notify = false;
        for (PushAction action : actions) {
            if (action.isDontNotify()) {
                continue;
            }
            notify |= action.isNotify();
            kept.add(action);
        }
        return notify ? List.copyOf(kept) : List.of();
    }

    private void reportMalformed(String userId, PushRule rule, String reason) {
        malformedRules.increment();
        if (logger.isLoggable(Level.FINE)) {
            logger.fine("Skipping malformed rule " + rule.ruleId() + " of " + userId + ": " + reason);
        }
    }
}
