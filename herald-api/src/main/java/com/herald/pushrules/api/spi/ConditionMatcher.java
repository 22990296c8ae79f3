/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

import com.herald.pushrules.api.model.PushCondition;

/**
 * Evaluates single push rule conditions against one event.
 *
 * <p>
 * Instances are bound to an event by {@link ConditionMatcherFactory}. Matching
 * is pure and synchronous.
 */
public interface ConditionMatcher {

    /**
     * @param condition   condition to test
     * @param userId      candidate recipient
     * @param displayName the recipient's display name in the room, may be null
     * @return true if the condition holds
     * @throws com.herald.pushrules.api.exceptions.MalformedRuleException if the
     *         condition kind is unknown or its parameters are unusable
     */
    boolean matches(PushCondition condition, String userId, String displayName);
}
