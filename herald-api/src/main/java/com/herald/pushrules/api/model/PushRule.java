/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single push rule of one user.
 *
 * <p>
 * Rules read from storage may be malformed: a rule without a condition list or
 * without an action list keeps the missing part as {@code null} and is reported
 * by {@link #isWellFormed()}. Such rules never match.
 *
 * @param ruleId     rule identifier, e.g. {@code .m.rule.message}
 * @param enabled    false when the user disabled the rule
 * @param conditions ordered condition list, null if missing
 * @param actions    ordered action list, null if missing
 */
public record PushRule(String ruleId, boolean enabled, List<PushCondition> conditions, List<PushAction> actions) {

    public PushRule {
        Objects.requireNonNull(ruleId, "ruleId");
        conditions = conditions == null ? null : Collections.unmodifiableList(new ArrayList<>(conditions));
        actions = actions == null ? null : Collections.unmodifiableList(new ArrayList<>(actions));
    }

    public static PushRule of(String ruleId, List<PushCondition> conditions, List<PushAction> actions) {
        return new PushRule(ruleId, true, conditions, actions);
    }

    public boolean isWellFormed() {
        return conditions != null && actions != null;
    }
}
