package com.asvarishch.rewards.calculation;

import com.asvarishch.rewards.enums.BadgeCategory;
import com.asvarishch.rewards.enums.BadgeRarity;
import lombok.Builder;

import java.util.Map;

@Builder
public record BadgeAward(
        String badgeType,
        BadgeCategory category,
        String title,
        String description,
        String icon,
        BadgeRarity rarity,
        Map<String, Object> metadata
) {

    public BadgeAward {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
