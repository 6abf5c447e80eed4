package com.asvarishch.rewards.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Builder
public record ParticipantRewardDTO(
        Long userId,
        int placement,
        int baseXp,
        int bonusXp,
        int totalXp,
        int credits,
        Map<String, BigDecimal> skillPoints,
        Map<String, BigDecimal> skillRatingDeltas,
        List<BadgeDTO> badges
) {
}
