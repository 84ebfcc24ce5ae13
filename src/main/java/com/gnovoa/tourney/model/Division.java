package com.gnovoa.tourney.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Pools that teams and matches are partitioned into. Play is division-scoped, refereeing is not. */
public enum Division {
    MIXED("mixed"),
    GENDERED("gendered"),
    CLOTH("cloth");

    private final String id;

    Division(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static Division fromId(String value) {
        for (Division d : values()) {
            if (d.id.equalsIgnoreCase(value) || d.name().equalsIgnoreCase(value)) return d;
        }
        throw new IllegalArgumentException("Unknown division " + value);
    }
}
