/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

import com.herald.pushrules.api.model.Event;
import com.herald.pushrules.api.model.Recipient;
import com.herald.pushrules.api.model.ResolutionContext;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Applies history visibility to a batch of events for a batch of readers.
 */
public interface EventVisibilityFilter {

    /**
     * @param recipients       readers to filter for
     * @param events           events to filter
     * @param contextByEventId room state at each event
     * @return per recipient user id, the events that user may see
     */
    CompletableFuture<Map<String, List<Event>>> filterEventsForRecipients(
            List<Recipient> recipients,
            List<Event> events,
            Map<String, ResolutionContext> contextByEventId);
}
