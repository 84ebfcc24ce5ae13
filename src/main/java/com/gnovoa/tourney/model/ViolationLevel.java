package com.gnovoa.tourney.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Severity of a rule violation, ordered from least to most severe. */
public enum ViolationLevel {
    NOTE,
    WARNING,
    ALERT,
    CRITICAL;

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
