package com.gnovoa.tourney.api;

import com.gnovoa.tourney.api.dto.EvaluationResponse;
import com.gnovoa.tourney.api.dto.MatchDto;
import com.gnovoa.tourney.api.dto.PlayerDto;
import com.gnovoa.tourney.api.dto.ScheduleRequest;
import com.gnovoa.tourney.api.dto.ViolationDto;
import com.gnovoa.tourney.model.ActivityType;
import com.gnovoa.tourney.model.Division;
import com.gnovoa.tourney.model.Match;
import com.gnovoa.tourney.model.Player;
import com.gnovoa.tourney.model.Team;
import com.gnovoa.tourney.schedule.Schedule;
import com.gnovoa.tourney.schedule.TeamDirectory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Converts between wire records and the scheduling model. */
@Component
public final class ScheduleMapper {

    /**
     * @throws IllegalArgumentException when the request has no matches or names a team its division
     *     does not know
     */
    public Schedule toSchedule(ScheduleRequest request) {
        if (request == null || request.matches() == null || request.matches().isEmpty()) {
            throw new IllegalArgumentException("A schedule needs at least one match");
        }
        List<Player> players = new ArrayList<>();
        if (request.players() != null) {
            for (PlayerDto p : request.players()) {
                players.add(Player.of(p.name(), p.mixedTeam(), p.genderedTeam(), p.clothTeam()));
            }
        }
        Map<Division, List<String>> declared = new EnumMap<>(Division.class);
        if (request.teams() != null) {
            request.teams().forEach((division, names) ->
                    declared.computeIfAbsent(Division.fromId(division), d -> new ArrayList<>()).addAll(names));
        }
        TeamDirectory directory = new TeamDirectory(players, declared);

        List<Match> matches = new ArrayList<>();
        for (MatchDto m : request.matches()) matches.add(toMatch(m, directory));
        return new Schedule(matches);
    }

    private static Match toMatch(MatchDto dto, TeamDirectory directory) {
        if (dto.division() == null) throw new IllegalArgumentException("Match division is required");
        ActivityType type = dto.activityType() == null ? ActivityType.REGULAR : dto.activityType();
        Division division = dto.division();

        Team team1 = type.isSpecial() ? directory.activityTeam(division, dto.team1()) : directory.team(division, dto.team1());
        Team team2 = type.isSpecial() ? directory.activityTeam(division, dto.team2()) : directory.team(division, dto.team2());
        if (!type.isSpecial() && team1.equals(team2)) {
            throw new IllegalArgumentException("Team " + team1.name() + " cannot play itself");
        }
        Team referee = directory.referee(dto.refereeTeam(), division);
        return new Match(team1, team2, dto.timeSlot(), dto.field(), division, referee, type,
                Boolean.TRUE.equals(dto.locked()));
    }

    public EvaluationResponse toResponse(Schedule schedule) {
        List<ViolationDto> violations = schedule.violations().stream()
                .map(v -> new ViolationDto(v.rule(), v.description(), v.level(), v.priority(),
                        v.matches().stream().map(Match::matchId).toList()))
                .toList();
        List<MatchDto> matches = schedule.matches().stream().map(ScheduleMapper::toDto).toList();
        return new EvaluationResponse(schedule.score(), violations, matches);
    }

    private static MatchDto toDto(Match m) {
        return new MatchDto(
                m.matchId(),
                m.team1().name(),
                m.team2().name(),
                m.timeSlot(),
                m.field(),
                m.division(),
                m.refereeTeam() == null ? null : m.refereeTeam().name(),
                m.activityType(),
                m.locked()
        );
    }
}
