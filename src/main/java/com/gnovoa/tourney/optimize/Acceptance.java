package com.gnovoa.tourney.optimize;

import com.gnovoa.tourney.random.RandomSource;
import com.gnovoa.tourney.schedule.Schedule;

final class Acceptance {

    private Acceptance() {}

    /** Always for a lower score, otherwise with probability exp(-delta / temperature). */
    static boolean metropolis(int currentScore, int candidateScore, double temperature, RandomSource random) {
        if (candidateScore < currentScore) return true;
        if (temperature <= 0) return candidateScore == currentScore;
        return random.nextDouble() < Math.exp((currentScore - candidateScore) / temperature);
    }

    /** A candidate with any critical violation is never taken, whatever the current schedule holds. */
    static boolean breaksHardConstraints(Schedule candidate) {
        return candidate.hasCriticalViolation();
    }
}
