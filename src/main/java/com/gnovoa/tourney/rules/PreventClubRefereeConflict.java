package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.List;

/**
 * A team should not referee while another team of its club plays in the same slot. The club is the
 * first word of the team name ("Hawks Red" belongs to "Hawks").
 */
public final class PreventClubRefereeConflict extends AbstractScheduleRule {

    public static final String NAME = "Prevent club referee conflict";

    public PreventClubRefereeConflict(int priority) {
        super(NAME, priority);
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byTimeSlot(MatchGroups.regular(schedule.matches())).forEach((slot, matches) -> {
            if (matches.size() < 2) return;
            for (Match reffed : matches) {
                Team ref = reffed.refereeTeam();
                if (ref == null || ref.isPlaceholder()) continue;
                String club = clubOf(ref.name());
                for (Match other : matches) {
                    if (other == reffed) continue;
                    Team clubTeam = clubOf(other.team1().name()).equals(club) ? other.team1()
                            : clubOf(other.team2().name()).equals(club) ? other.team2() : null;
                    if (clubTeam == null) continue;
                    out.add(violation(
                            "Team %s is refereeing in slot %d while club team (%s) is playing in the same slot"
                                    .formatted(ref.name(), slot, clubTeam.name()),
                            List.of(reffed, other), ViolationLevel.WARNING));
                }
            }
        });
        return out;
    }

    static String clubOf(String teamName) {
        String trimmed = teamName.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
