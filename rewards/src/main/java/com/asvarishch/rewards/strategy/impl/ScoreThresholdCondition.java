package com.asvarishch.rewards.strategy.impl;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import com.asvarishch.rewards.strategy.BadgeConditionStrategy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * SCORE_THRESHOLD: the ranking score reached at least the configured threshold.
 * Participants without a recorded score never qualify.
 */
@Component
public class ScoreThresholdCondition implements BadgeConditionStrategy {

    @Override
    public BadgeConditionType getType() {
        return BadgeConditionType.SCORE_THRESHOLD;
    }

    @Override
    public boolean isSatisfied(BadgeCondition condition, ParticipantContext context) {
        if (condition == null || condition.threshold() == null || context == null || context.score() == null) {
            return false;
        }
        return BigDecimal.valueOf(context.score()).compareTo(condition.threshold()) >= 0;
    }
}
