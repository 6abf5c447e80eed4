package com.asvarishch.rewards.calculation;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Computed, not yet persisted, rewards of one participant.
 */
@Builder
public record ParticipantReward(
        Long userId,
        int placement,
        int baseXp,
        int bonusXp,
        int totalXp,
        int credits,
        Map<String, BigDecimal> skillPoints,
        Map<String, BigDecimal> skillRatingDeltas,
        List<BadgeAward> badges
) {
}
