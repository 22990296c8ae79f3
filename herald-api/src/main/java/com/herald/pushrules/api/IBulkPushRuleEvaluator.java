/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api;

import com.herald.pushrules.api.model.Event;
import com.herald.pushrules.api.model.PushAction;
import com.herald.pushrules.api.model.ResolutionContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Computes the push actions of every interested room member for one event.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * IBulkPushRuleEvaluator evaluator = // obtain from the application context
 *
 * evaluator.evaluate(event, context).thenAccept(actionsByUser ->
 *     actionsByUser.forEach((userId, actions) -> pusherPool.notify(userId, event, actions)));
 * }</pre>
 *
 * <h2>Result</h2>
 * <p>
 * The map holds only users that are to be notified. A user missing from the
 * map gets no notification. The sender of the event is never in the map.
 *
 * <h2>Failures</h2>
 * <p>
 * If a storage lookup fails the future completes exceptionally with a
 * {@link com.herald.pushrules.api.exceptions.RuleResolutionException}; no
 * partial result is produced.
 */
public interface IBulkPushRuleEvaluator {

    /**
     * @param event   the event to push (must not be null)
     * @param context room state at the event (must not be null)
     * @return future of user id to the actions of the first matching rule
     */
    CompletableFuture<Map<String, List<PushAction>>> evaluate(Event event, ResolutionContext context);
}
