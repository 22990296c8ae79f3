/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Iterator;
import java.util.List;

/**
 * Ordered push rules of a single user, highest priority first.
 */
public record RuleSet(List<PushRule> rules) implements Iterable<PushRule> {

    public RuleSet {
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public static RuleSet of(PushRule... rules) {
        return new RuleSet(List.of(rules));
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public Iterator<PushRule> iterator() {
        return rules.iterator();
    }
}
