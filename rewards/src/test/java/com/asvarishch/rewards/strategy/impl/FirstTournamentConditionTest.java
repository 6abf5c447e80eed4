package com.asvarishch.rewards.strategy.impl;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for FirstTournamentCondition and PerfectScoreCondition.
 */
class FirstTournamentConditionTest {

    private final FirstTournamentCondition firstTournament = new FirstTournamentCondition();
    private final PerfectScoreCondition perfectScore = new PerfectScoreCondition();

    private static ParticipantContext context(int priorTournaments, Integer score) {
        return ParticipantContext.builder()
                .userId(7L)
                .placement(1)
                .totalParticipants(4)
                .priorTournamentCount(priorTournaments)
                .score(score)
                .build();
    }

    @Test
    @DisplayName("FIRST_TOURNAMENT holds only without earlier rewarded tournaments")
    void firstTournament() {
        BadgeCondition condition = BadgeCondition.of(BadgeConditionType.FIRST_TOURNAMENT);

        assertTrue(firstTournament.isSatisfied(condition, context(0, null)));
        assertFalse(firstTournament.isSatisfied(condition, context(1, null)));
    }

    @Test
    @DisplayName("PERFECT_SCORE needs a score of 100")
    void perfectScore() {
        BadgeCondition condition = BadgeCondition.of(BadgeConditionType.PERFECT_SCORE);

        assertTrue(perfectScore.isSatisfied(condition, context(3, 100)));
        assertFalse(perfectScore.isSatisfied(condition, context(3, 99)));
        assertFalse(perfectScore.isSatisfied(condition, context(3, null)));
    }
}
