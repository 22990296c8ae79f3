/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.exceptions;

/**
 * Raised for push rule data that cannot be interpreted: an unknown condition
 * kind, unusable parameters or undecodable stored JSON.
 *
 * <p>
 * Evaluation treats the affected rule as non-matching and carries on.
 */
public class MalformedRuleException extends RuntimeException {

    public MalformedRuleException(String message) {
        super(message);
    }

    public MalformedRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
