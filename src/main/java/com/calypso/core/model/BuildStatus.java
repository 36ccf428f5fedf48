package com.calypso.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a {@link BuildOutput}. The only legal transitions are
 * {@code GENERATING -> COMPLETE} and {@code GENERATING -> FAILED}.
 */
public enum BuildStatus {
    GENERATING,
    COMPLETE,
    FAILED;

    public boolean canTransitionTo(BuildStatus next) {
        return this == GENERATING && (next == COMPLETE || next == FAILED);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
