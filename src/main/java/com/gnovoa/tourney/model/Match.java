package com.gnovoa.tourney.model;

import java.util.Objects;
import java.util.UUID;

/**
 * A fixture between two teams, or a setup/pack-down activity staffed by them.
 *
 * <p>Teams, division and activity type never change. Time slot, field and referee are mutable so a
 * schedule copy can be perturbed in place; every mutation operator works on its own copy.
 */
public final class Match {

    private final String matchId;
    private final Team team1;
    private final Team team2;
    private final Division division;
    private final ActivityType activityType;

    private int timeSlot;
    private String field;
    private Team refereeTeam;
    private boolean locked;

    public Match(Team team1, Team team2, int timeSlot, String field, Division division,
                 Team refereeTeam, ActivityType activityType, boolean locked) {
        this("m-" + UUID.randomUUID(), team1, team2, timeSlot, field, division, refereeTeam, activityType, locked);
    }

    public Match(Team team1, Team team2, int timeSlot, String field, Division division, Team refereeTeam) {
        this(team1, team2, timeSlot, field, division, refereeTeam, ActivityType.REGULAR, false);
    }

    private Match(String matchId, Team team1, Team team2, int timeSlot, String field, Division division,
                  Team refereeTeam, ActivityType activityType, boolean locked) {
        this.matchId = Objects.requireNonNull(matchId, "matchId");
        this.team1 = Objects.requireNonNull(team1, "team1");
        this.team2 = Objects.requireNonNull(team2, "team2");
        this.division = Objects.requireNonNull(division, "division");
        this.activityType = activityType == null ? ActivityType.REGULAR : activityType;
        this.timeSlot = timeSlot;
        this.field = field == null ? "" : field;
        this.refereeTeam = refereeTeam;
        this.locked = locked || this.activityType.isSpecial();
    }

    /** Independent copy with the same id, sharing the immutable team references. */
    public Match copy() {
        return new Match(matchId, team1, team2, timeSlot, field, division, refereeTeam, activityType, locked);
    }

    public String matchId() { return matchId; }
    public Team team1() { return team1; }
    public Team team2() { return team2; }
    public Division division() { return division; }
    public ActivityType activityType() { return activityType; }
    public int timeSlot() { return timeSlot; }
    public String field() { return field; }
    public Team refereeTeam() { return refereeTeam; }
    public boolean locked() { return locked; }

    public boolean isSpecialActivity() {
        return activityType.isSpecial();
    }

    public boolean isRegular() {
        return activityType == ActivityType.REGULAR;
    }

    /** Regular and unlocked: free to be moved by the search. */
    public boolean isMovable() {
        return isRegular() && !locked;
    }

    public void setTimeSlot(int timeSlot) {
        this.timeSlot = timeSlot;
    }

    public void setField(String field) {
        this.field = field == null ? "" : field;
    }

    public void setRefereeTeam(Team refereeTeam) {
        this.refereeTeam = refereeTeam;
    }

    public void setLocked(boolean locked) {
        this.locked = locked || activityType.isSpecial();
    }

    public boolean plays(Team team) {
        return team1.equals(team) || team2.equals(team);
    }

    public boolean referees(Team team) {
        return refereeTeam != null && refereeTeam.equals(team);
    }

    /** Plays or referees. */
    public boolean involves(Team team) {
        return plays(team) || referees(team);
    }

    public boolean hasPlayer(String playerName) {
        return team1.hasPlayer(playerName) || team2.hasPlayer(playerName);
    }

    /** Same unordered team pair, slot and field. Used to locate a match inside a copied schedule. */
    public boolean sameFixture(Match other) {
        if (other == null) return false;
        boolean samePair = (team1.equals(other.team1) && team2.equals(other.team2))
                || (team1.equals(other.team2) && team2.equals(other.team1));
        return samePair && timeSlot == other.timeSlot && field.equals(other.field);
    }

    @Override
    public String toString() {
        String ref = refereeTeam == null ? "-" : refereeTeam.name();
        return "%s vs %s @%d %s [%s, ref %s]".formatted(team1.name(), team2.name(), timeSlot, field, activityType, ref);
    }
}
