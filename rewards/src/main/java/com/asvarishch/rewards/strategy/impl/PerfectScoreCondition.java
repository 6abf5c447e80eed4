package com.asvarishch.rewards.strategy.impl;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import com.asvarishch.rewards.strategy.BadgeConditionStrategy;
import org.springframework.stereotype.Component;

/**
 * PERFECT_SCORE: the ranking score is the maximum of 100.
 */
@Component
public class PerfectScoreCondition implements BadgeConditionStrategy {

    static final int PERFECT_SCORE = 100;

    @Override
    public BadgeConditionType getType() {
        return BadgeConditionType.PERFECT_SCORE;
    }

    @Override
    public boolean isSatisfied(BadgeCondition condition, ParticipantContext context) {
        return context != null && context.score() != null && context.score() >= PERFECT_SCORE;
    }
}
