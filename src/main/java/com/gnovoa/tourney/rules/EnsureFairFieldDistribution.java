package com.gnovoa.tourney.rules;

import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.RuleViolation;
import com.gnovoa.tourney.model.ViolationLevel;
import com.gnovoa.tourney.schedule.Schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Flags a team that plays more than {@code threshold} of its games (at least {@code minGames}) on one field. */
public final class EnsureFairFieldDistribution extends AbstractScheduleRule {

    public static final String NAME = "Ensure fair field distribution";

    private final double threshold;
    private final int minGames;

    public EnsureFairFieldDistribution(int priority, double threshold, int minGames) {
        super(NAME, priority);
        if (threshold <= 0 || threshold > 1) throw new IllegalArgumentException("threshold must be in (0, 1]");
        this.threshold = threshold;
        this.minGames = minGames;
    }

    @Override
    public List<RuleViolation> evaluate(Schedule schedule) {
        List<RuleViolation> out = new ArrayList<>();
        MatchGroups.byPlayingTeam(MatchGroups.regular(schedule.matches())).forEach((team, games) -> {
            if (games.size() < minGames) return;
            Map<String, List<Match>> byField = new LinkedHashMap<>();
            for (Match m : games) byField.computeIfAbsent(m.field(), k -> new ArrayList<>()).add(m);

            Map.Entry<String, List<Match>> dominant = null;
            for (var e : byField.entrySet()) {
                if (dominant == null || e.getValue().size() > dominant.getValue().size()) dominant = e;
            }
            int onField = dominant.getValue().size();
            if ((double) onField / games.size() > threshold) {
                out.add(violation(
                        "Team %s plays %d/%d games on %s".formatted(team.name(), onField, games.size(), dominant.getKey()),
                        dominant.getValue(), ViolationLevel.WARNING));
            }
        });
        return out;
    }
}
