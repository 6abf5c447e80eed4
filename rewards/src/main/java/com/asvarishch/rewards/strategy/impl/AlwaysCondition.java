package com.asvarishch.rewards.strategy.impl;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import com.asvarishch.rewards.strategy.BadgeConditionStrategy;
import org.springframework.stereotype.Component;

@Component
public class AlwaysCondition implements BadgeConditionStrategy {

    @Override
    public BadgeConditionType getType() {
        return BadgeConditionType.ALWAYS;
    }

    @Override
    public boolean isSatisfied(BadgeCondition condition, ParticipantContext context) {
        return true;
    }
}
