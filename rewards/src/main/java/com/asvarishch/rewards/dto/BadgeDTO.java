package com.asvarishch.rewards.dto;

import com.asvarishch.rewards.enums.BadgeCategory;
import com.asvarishch.rewards.enums.BadgeRarity;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record BadgeDTO(
        Long tournamentId,
        String badgeType,
        BadgeCategory category,
        String title,
        String description,
        String icon,
        BadgeRarity rarity,
        Map<String, Object> metadata,
        Instant awardedAt
) {
}
