package com.gnovoa.tourney.rules;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds rule instances from {@link RuleId} defaults merged with {@link RuleProperties} overrides.
 */
@Component
public final class RuleCatalog {

    private final RuleProperties props;

    public RuleCatalog(RuleProperties props) {
        this.props = props == null ? RuleProperties.defaults() : props;
        for (String key : this.props.catalog().keySet()) RuleId.fromId(key); // fail fast on typos
    }

    /** Every enabled rule, in catalog order. */
    public List<ScheduleRule> enabledRules() {
        List<ScheduleRule> rules = new ArrayList<>();
        for (RuleId id : RuleId.values()) {
            if (isEnabled(id)) rules.add(create(id));
        }
        return rules;
    }

    /** The named rules, whether enabled or not. An empty selection means {@link #enabledRules()}. */
    public List<ScheduleRule> rules(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) return enabledRules();
        return ids.stream().map(RuleId::fromId).distinct().map(this::create).toList();
    }

    public ScheduleRule create(RuleId id) {
        int priority = priority(id);
        Map<String, Double> p = parameters(id);
        return switch (id) {
            case AVOID_PLAYING_AFTER_SETUP -> new AvoidPlayingAfterSetup(priority);
            case BACK_TO_BACK -> new AvoidBackToBackGames(priority);
            case FIRST_LAST -> new AvoidFirstAndLastGame(priority);
            case REFFING_BEFORE_PLAYING -> new AvoidReffingBeforePlaying(priority);
            case LIMIT_VENUE_TIME -> new LimitVenueTime(priority,
                    p.get("maxHours"), p.get("minutesPerSlot").intValue(), p.get("toleranceHours"));
            case FAIR_FIELD_DISTRIBUTION -> new EnsureFairFieldDistribution(priority,
                    p.get("threshold"), p.get("minGames").intValue());
            case REST_AND_GAPS -> new ManageRestTimeAndGaps(priority,
                    p.get("minRestSlots").intValue(), p.get("maxGapSlots").intValue());
            case PLAYER_GAME_BALANCE -> new ManagePlayerGameBalance(priority,
                    p.get("maxGames").intValue(), p.get("maxGameDifference").intValue());
            case WARMUP_TIME -> new EnsurePlayerWarmupTime(priority, p.get("minWarmupSlots").intValue());
            case BALANCE_REFEREES -> new BalanceRefereeAssignments(priority, p.get("maxRefereeDifference").intValue());
            case MIXED_DIVISIONS_IN_SLOT -> new DetectMixedDivisionsInTimeSlot(priority);
            case CLUB_REFEREE_CONFLICT -> new PreventClubRefereeConflict(priority);
        };
    }

    public List<RuleDescriptor> describe() {
        List<RuleDescriptor> out = new ArrayList<>();
        for (RuleId id : RuleId.values()) {
            out.add(new RuleDescriptor(id.id(), id.displayName(), priority(id), isEnabled(id), parameters(id)));
        }
        return out;
    }

    public boolean isEnabled(RuleId id) {
        RuleProperties.RuleSettings s = settings(id);
        return s == null || s.enabled() == null ? id.enabledByDefault() : s.enabled();
    }

    private int priority(RuleId id) {
        RuleProperties.RuleSettings s = settings(id);
        return s == null || s.priority() == null ? id.defaultPriority() : s.priority();
    }

    /** Defaults overlaid with configured values; configured keys match case- and dash-insensitively. */
    private Map<String, Double> parameters(RuleId id) {
        Map<String, Double> merged = new LinkedHashMap<>(id.defaultParameters());
        RuleProperties.RuleSettings s = settings(id);
        if (s == null) return Map.copyOf(merged);
        s.parameters().forEach((key, value) -> {
            String wanted = normalize(key);
            String match = id.defaultParameters().keySet().stream()
                    .filter(k -> normalize(k).equals(wanted))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown parameter " + key + " for rule " + id.id()));
            merged.put(match, value);
        });
        return Map.copyOf(merged);
    }

    private RuleProperties.RuleSettings settings(RuleId id) {
        for (var e : props.catalog().entrySet()) {
            if (RuleId.fromId(e.getKey()) == id) return e.getValue();
        }
        return null;
    }

    private static String normalize(String key) {
        return key.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
