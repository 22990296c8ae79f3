/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Map;

/**
 * Room state at the point of an event, supplied by state resolution.
 *
 * <p>
 * The state group is an opaque version token: two contexts with equal state
 * groups describe identical room state. It carries no ordering. A context
 * without a state group never matches a cached token.
 *
 * @param stateGroup      opaque state version token, may be null
 * @param currentStateIds (event type, state key) to the id of the event holding that state
 */
public record ResolutionContext(Object stateGroup, Map<StateKey, String> currentStateIds) {

    public ResolutionContext {
        currentStateIds = currentStateIds == null ? Map.of() : Map.copyOf(currentStateIds);
    }
}
