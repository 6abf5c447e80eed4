package com.asvarishch.rewards.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
public record UserRewardResponse(
        Long tournamentId,
        Long userId,
        int placement,
        int baseXp,
        int bonusXp,
        int totalXp,
        int credits,
        Map<String, BigDecimal> skillPoints,
        Map<String, BigDecimal> skillRatingDeltas,
        Instant distributedAt,
        String distributedBy,
        int redistributionCount,
        List<BadgeDTO> badges,
        BadgeDTO rarestBadge
) {
}
