/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.spi;

/**
 * Synchronous facts about user ids known to this homeserver.
 */
public interface HomeserverUsers {

    /**
     * @return true if the user account lives on this server
     */
    boolean isLocallyHomed(String userId);

    /**
     * @return true if the account is controlled by an application service
     */
    boolean isApplicationServiceUser(String userId);
}
