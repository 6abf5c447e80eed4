package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.BadgeConditionType;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * When a configured badge is granted. {@code threshold} is only read by {@link BadgeConditionType#SCORE_THRESHOLD}.
 */
public record BadgeCondition(BadgeConditionType type, BigDecimal threshold) {

    public static final BadgeCondition ALWAYS = new BadgeCondition(BadgeConditionType.ALWAYS, null);

    public BadgeCondition {
        Objects.requireNonNull(type, "condition type must not be null");
    }

    public static BadgeCondition of(BadgeConditionType type) {
        return new BadgeCondition(type, null);
    }

    public boolean isUnconditional() {
        return type == BadgeConditionType.ALWAYS;
    }
}
