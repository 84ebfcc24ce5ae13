package com.gnovoa.tourney.model;

import java.util.List;
import java.util.Objects;

/**
 * A team within one division. Teams are reference data shared by every copy of a schedule.
 *
 * <p>Equality is by name and division only: the same team may be rebuilt with a different player
 * list and must still be recognised as the same participant.
 */
public record Team(String name, Division division, List<Player> players) {

    /** Name of the stand-in team used for unstaffed special activities. */
    public static final String PLACEHOLDER_NAME = "ACTIVITY_PLACEHOLDER";

    public Team {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Team name is required");
        Objects.requireNonNull(division, "division");
        players = players == null ? List.of() : List.copyOf(players);
    }

    public static Team placeholder(Division division) {
        return new Team(PLACEHOLDER_NAME, division, List.of());
    }

    public boolean isPlaceholder() {
        return PLACEHOLDER_NAME.equals(name);
    }

    /** Name plus division, unique across the tournament. */
    public String key() {
        return division.id() + ":" + name;
    }

    public boolean hasPlayer(String playerName) {
        return players.stream().anyMatch(p -> p.name().equals(playerName));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Team other)) return false;
        return name.equals(other.name) && division == other.division;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, division);
    }

    @Override
    public String toString() {
        return name + " (" + division.id() + ")";
    }
}
