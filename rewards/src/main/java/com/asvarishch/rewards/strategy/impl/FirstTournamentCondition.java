package com.asvarishch.rewards.strategy.impl;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import com.asvarishch.rewards.strategy.BadgeConditionStrategy;
import org.springframework.stereotype.Component;

/**
 * FIRST_TOURNAMENT: the user has not been rewarded for any other tournament yet.
 */
@Component
public class FirstTournamentCondition implements BadgeConditionStrategy {

    @Override
    public BadgeConditionType getType() {
        return BadgeConditionType.FIRST_TOURNAMENT;
    }

    @Override
    public boolean isSatisfied(BadgeCondition condition, ParticipantContext context) {
        return context != null && context.isFirstTournament();
    }
}
