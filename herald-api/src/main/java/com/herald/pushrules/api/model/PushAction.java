/*
 * Copyright (c) 2025 Herald Push Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.herald.pushrules.api.model;

import java.util.Objects;

/**
 * An action attached to a push rule.
 *
 * <p>
 * Plain actions ({@code notify}, {@code dont_notify}, {@code coalesce}) carry
 * only a kind. Tweaks ({@code set_tweak}) also carry the tweak name and an
 * optional value, e.g. {@code sound=default} or {@code highlight}.
 *
 * @param kind  action kind
 * @param tweak tweak name for {@code set_tweak} actions, otherwise null
 * @param value tweak value, may be null
 */
public record PushAction(String kind, String tweak, Object value) {

    public static final String KIND_NOTIFY = "notify";
    public static final String KIND_DONT_NOTIFY = "dont_notify";
    public static final String KIND_COALESCE = "coalesce";
    public static final String KIND_SET_TWEAK = "set_tweak";

    public static final PushAction NOTIFY = new PushAction(KIND_NOTIFY, null, null);
    public static final PushAction DONT_NOTIFY = new PushAction(KIND_DONT_NOTIFY, null, null);
    public static final PushAction COALESCE = new PushAction(KIND_COALESCE, null, null);

    public PushAction {
        Objects.requireNonNull(kind, "kind");
        if (KIND_SET_TWEAK.equals(kind) && tweak == null) {
            throw new IllegalArgumentException("set_tweak action requires a tweak name");
        }
    }

    public static PushAction tweak(String name, Object value) {
        return new PushAction(KIND_SET_TWEAK, name, value);
    }

    public static PushAction sound(String sound) {
        return tweak("sound", sound);
    }

    public static PushAction highlight() {
        return tweak("highlight", null);
    }

    public boolean isNotify() {
        return KIND_NOTIFY.equals(kind);
    }

    public boolean isDontNotify() {
        return KIND_DONT_NOTIFY.equals(kind);
    }

    @Override
    public String toString() {
        if (tweak == null) {
            return kind;
        }
        return value == null ? tweak : tweak + "=" + value;
    }
}
