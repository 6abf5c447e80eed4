package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.BadgeRarity;
import lombok.Builder;

/**
 * Badge definition inside a placement tier. {@code description} may contain {@code {tournament_name}}.
 */
@Builder
public record BadgeSpec(
        String badgeType,
        String icon,
        String title,
        String description,
        BadgeRarity rarity,
        boolean enabled,
        BadgeCondition condition
) {

    public BadgeSpec {
        if (rarity == null) {
            rarity = BadgeRarity.COMMON;
        }
        if (condition == null) {
            condition = BadgeCondition.ALWAYS;
        }
        if (title == null) {
            title = badgeType;
        }
    }
}
