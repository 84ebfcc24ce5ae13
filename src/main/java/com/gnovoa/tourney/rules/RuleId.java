package com.gnovoa.tourney.rules;

import java.util.Map;

/** Built-in rules with their default settings. */
public enum RuleId {
    AVOID_PLAYING_AFTER_SETUP("avoid-playing-after-setup", AvoidPlayingAfterSetup.NAME, 10, true, Map.of()),
    BACK_TO_BACK("back-to-back", AvoidBackToBackGames.NAME, 5, true, Map.of()),
    FIRST_LAST("first-last", AvoidFirstAndLastGame.NAME, 4, true, Map.of()),
    REFFING_BEFORE_PLAYING("reffing-before-playing", AvoidReffingBeforePlaying.NAME, 4, true, Map.of()),
    LIMIT_VENUE_TIME("limit-venue-time", LimitVenueTime.NAME, 2, true,
            Map.of("maxHours", 5.0, "minutesPerSlot", 30.0, "toleranceHours", 0.5)),
    FAIR_FIELD_DISTRIBUTION("fair-field-distribution", EnsureFairFieldDistribution.NAME, 2, true,
            Map.of("threshold", 0.6, "minGames", 3.0)),
    REST_AND_GAPS("rest-and-gaps", ManageRestTimeAndGaps.NAME, 1, true,
            Map.of("minRestSlots", 2.0, "maxGapSlots", 6.0)),
    PLAYER_GAME_BALANCE("player-game-balance", ManagePlayerGameBalance.NAME, 1, true,
            Map.of("maxGames", 4.0, "maxGameDifference", 1.0)),
    WARMUP_TIME("warmup-time", EnsurePlayerWarmupTime.NAME, 1, false,
            Map.of("minWarmupSlots", 1.0)),
    BALANCE_REFEREES("balance-referees", BalanceRefereeAssignments.NAME, 3, true,
            Map.of("maxRefereeDifference", 1.0)),
    MIXED_DIVISIONS_IN_SLOT("mixed-divisions-in-slot", DetectMixedDivisionsInTimeSlot.NAME, 2, true, Map.of()),
    CLUB_REFEREE_CONFLICT("club-referee-conflict", PreventClubRefereeConflict.NAME, 3, true, Map.of());

    private final String id;
    private final String displayName;
    private final int defaultPriority;
    private final boolean enabledByDefault;
    private final Map<String, Double> defaultParameters;

    RuleId(String id, String displayName, int defaultPriority, boolean enabledByDefault,
           Map<String, Double> defaultParameters) {
        this.id = id;
        this.displayName = displayName;
        this.defaultPriority = defaultPriority;
        this.enabledByDefault = enabledByDefault;
        this.defaultParameters = defaultParameters;
    }

    public String id() { return id; }
    public String displayName() { return displayName; }
    public int defaultPriority() { return defaultPriority; }
    public boolean enabledByDefault() { return enabledByDefault; }
    public Map<String, Double> defaultParameters() { return defaultParameters; }

    public static RuleId fromId(String value) {
        for (RuleId r : values()) {
            if (r.id.equalsIgnoreCase(value) || r.name().equalsIgnoreCase(value)) return r;
        }
        throw new IllegalArgumentException("Unknown rule " + value);
    }
}
