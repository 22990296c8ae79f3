/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

import com.herald.pushrules.api.model.Event;

/**
 * Creates a {@link ConditionMatcher} for one event.
 */
@FunctionalInterface
public interface ConditionMatcherFactory {

    /**
     * @param event           the event being pushed
     * @param roomMemberCount number of joined members, for member-count conditions
     */
    ConditionMatcher forEvent(Event event, int roomMemberCount);
}
