/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.runtime.evaluation;

import com.herald.pushrules.api.model.PushCondition;
import com.herald.pushrules.api.spi.ConditionMatcher;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Condition results shared across all recipients of one event.
 *
 * <p>
 * Only conditions carrying a cache id take part. Such conditions do not depend
 * on the recipient, so the first evaluation for the event answers for every
 * later user. Not thread-safe: one instance serves one evaluation.
 */
public final class ConditionMemo {

    private final Map<String, Boolean> results = new HashMap<>();

    /**
     * Checks the conditions in order and stops at the first one that fails.
     *
     * @throws com.herald.pushrules.api.exceptions.MalformedRuleException from the
     *         matcher; nothing is recorded for the failing condition
     */
    public boolean allMatch(List<PushCondition> conditions,
                            ConditionMatcher matcher,
                            String userId,
                            String displayName) {
        for (PushCondition condition : conditions) {
            Optional<String> memoKey = condition.memoKey();
            if (memoKey.isPresent()) {
                Boolean known = results.get(memoKey.get());
                if (Boolean.FALSE.equals(known)) {
                    return false;
                }
                if (Boolean.TRUE.equals(known)) {
                    continue;
                }
            }

            boolean matched = matcher.matches(condition, userId, displayName);
            memoKey.ifPresent(key -> results.put(key, matched));
            if (!matched) {
                return false;
            }
        }
        return true;
    }

    public int size() {
        return results.size();
    }
}
