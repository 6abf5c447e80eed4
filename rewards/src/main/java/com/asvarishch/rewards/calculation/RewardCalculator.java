package com.asvarishch.rewards.calculation;

import com.asvarishch.rewards.config.RewardProperties;
import com.asvarishch.rewards.enums.SkillCategory;
import com.asvarishch.rewards.policy.PlacementTier;
import com.asvarishch.rewards.policy.RewardPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pure per-participant reward computation; no repository access.
 * <ol>
 *   <li>Tier: exact rank for 1-3, participation tier otherwise.</li>
 *   <li>{@code base_xp = floor(tier.base_xp * tier.xp_multiplier)}, credits from the tier.</li>
 *   <li>Tier point pool split over the enabled skills.</li>
 *   <li>{@code bonus_xp = sum(floor(points * xp rate of the skill's category))}.</li>
 *   <li>Skill rating delta per awarded skill via {@link SkillProgressionCalculator}.</li>
 *   <li>Badges via {@link BadgeAssignmentEngine}.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class RewardCalculator {

    private final SkillPointDistributor distributor;
    private final SkillProgressionCalculator progressionCalculator;
    private final BadgeAssignmentEngine badgeEngine;
    private final RewardProperties properties;

    public ParticipantReward calculate(RewardPolicy policy, ParticipantContext context) {
        final PlacementTier tier = policy.tierFor(context.placement());

        final int baseXp = BigDecimal.valueOf(tier.baseXp())
                .multiply(tier.xpMultiplier())
                .setScale(0, RoundingMode.FLOOR)
                .intValueExact();

        final Map<String, BigDecimal> skillPoints = distributor.distribute(tier.skillPointPool(), policy.skillMappings());
        final int bonusXp = bonusXp(skillPoints, policy);
        final Map<String, BigDecimal> ratingDeltas = ratingDeltas(skillPoints, context);

        return ParticipantReward.builder()
                .userId(context.userId())
                .placement(context.placement())
                .baseXp(baseXp)
                .bonusXp(bonusXp)
                .totalXp(Math.addExact(baseXp, bonusXp))
                .credits(tier.credits())
                .skillPoints(skillPoints)
                .skillRatingDeltas(ratingDeltas)
                .badges(badgeEngine.assign(context, policy))
                .build();
    }

    private int bonusXp(Map<String, BigDecimal> skillPoints, RewardPolicy policy) {
        int bonus = 0;
        for (Map.Entry<String, BigDecimal> e : skillPoints.entrySet()) {
            final SkillCategory category = policy.categoryOf(e.getKey()).orElse(SkillCategory.PHYSICAL);
            bonus += e.getValue()
                    .multiply(BigDecimal.valueOf(properties.xpRate(category)))
                    .setScale(0, RoundingMode.FLOOR)
                    .intValueExact();
        }
        return bonus;
    }

    /**
     * Change of each awarded skill relative to its baseline, counting this tournament.
     */
    private Map<String, BigDecimal> ratingDeltas(Map<String, BigDecimal> skillPoints, ParticipantContext context) {
        final Map<String, BigDecimal> deltas = new LinkedHashMap<>();
        for (String skill : skillPoints.keySet()) {
            final BigDecimal baseline = context.skillBaselines()
                    .getOrDefault(skill, SkillProgressionCalculator.DEFAULT_BASELINE);
            final int tournamentCount = context.priorSkillTournaments().getOrDefault(skill, 0) + 1;
            final BigDecimal value = progressionCalculator.calculate(
                    baseline, context.placement(), context.totalParticipants(), tournamentCount);
            deltas.put(skill, value.subtract(baseline));
        }
        return deltas;
    }
}
