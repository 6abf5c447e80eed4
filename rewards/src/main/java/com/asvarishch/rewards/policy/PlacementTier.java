package com.asvarishch.rewards.policy;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Rewards of one placement bracket.
 *
 * @param baseXp         XP before the multiplier
 * @param xpMultiplier   applied to {@code baseXp}, result is floored
 * @param credits        flat credit award
 * @param skillPointPool points split across the enabled skill mappings
 * @param badges         badges configured for the bracket, possibly conditional
 */
@Builder(toBuilder = true)
public record PlacementTier(
        int baseXp,
        BigDecimal xpMultiplier,
        int credits,
        BigDecimal skillPointPool,
        List<BadgeSpec> badges
) {

    public PlacementTier {
        xpMultiplier = xpMultiplier == null ? BigDecimal.ONE : xpMultiplier;
        skillPointPool = skillPointPool == null ? BigDecimal.ZERO : skillPointPool;
        badges = badges == null ? List.of() : List.copyOf(badges);
    }

    public List<BadgeSpec> enabledBadges() {
        return badges.stream().filter(BadgeSpec::enabled).toList();
    }
}
