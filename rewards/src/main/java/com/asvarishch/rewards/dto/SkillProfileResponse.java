package com.asvarishch.rewards.dto;

import com.asvarishch.rewards.enums.SkillTier;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

@Builder
public record SkillProfileResponse(
        Long userId,
        Map<String, SkillLevel> skills,
        BigDecimal averageLevel,
        int totalTournaments
) {

    /**
     * @param currentLevel    baseline blended with the latest placement
     * @param tournamentDelta {@code currentLevel - baseline}
     * @param ledgerPoints    net skill points from the reward ledger
     */
    @Builder
    public record SkillLevel(
            BigDecimal baseline,
            BigDecimal currentLevel,
            BigDecimal tournamentDelta,
            BigDecimal ledgerPoints,
            int tournamentCount,
            SkillTier tier
    ) {}
}
