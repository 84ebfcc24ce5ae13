package com.gnovoa.tourney.model;

public enum ActivityType {
    REGULAR,
    SETUP,
    PACKING_DOWN;

    public boolean isSpecial() {
        return this != REGULAR;
    }
}
