package com.asvarishch.rewards.enums;

import java.math.BigDecimal;

public enum SkillTier {
    MASTER(new BigDecimal("95")),
    ADVANCED(new BigDecimal("85")),
    INTERMEDIATE(new BigDecimal("70")),
    DEVELOPING(new BigDecimal("50")),
    BEGINNER(BigDecimal.ZERO);

    private final BigDecimal threshold;

    SkillTier(BigDecimal threshold) {
        this.threshold = threshold;
    }

    public BigDecimal getThreshold() {
        return threshold;
    }

    public static SkillTier of(BigDecimal value) {
        if (value == null) {
            return BEGINNER;
        }
        for (SkillTier tier : values()) {
            if (value.compareTo(tier.threshold) >= 0) {
                return tier;
            }
        }
        return BEGINNER;
    }
}
