package com.asvarishch.rewards.strategy;

import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;

public interface BadgeConditionStrategy {

    BadgeConditionType getType();

    boolean isSatisfied(BadgeCondition condition, ParticipantContext context);
}
