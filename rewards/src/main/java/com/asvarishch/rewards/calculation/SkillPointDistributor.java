package com.asvarishch.rewards.calculation;

import com.asvarishch.rewards.policy.SkillMapping;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a placement's skill point pool across the enabled skill mappings, proportionally to weight.
 * <p>
 * Each share is rounded half-up to one decimal on its own; the rounding remainder is not
 * pushed back into any skill, so the shares may sum to slightly more or less than the pool.
 */
@Component
public class SkillPointDistributor {

    static final int POINT_SCALE = 1;

    public Map<String, BigDecimal> distribute(BigDecimal totalPoints, List<SkillMapping> skillMappings) {
        final Map<String, BigDecimal> allocation = new LinkedHashMap<>();
        if (totalPoints == null || totalPoints.signum() <= 0 || skillMappings == null) {
            return allocation;
        }

        final List<SkillMapping> enabled = skillMappings.stream()
                .filter(SkillMapping::enabled)
                .filter(m -> m.weight() != null && m.weight().signum() > 0)
                .toList();
        if (enabled.isEmpty()) {
            return allocation;
        }

        final BigDecimal totalWeight = enabled.stream()
                .map(SkillMapping::weight)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        for (SkillMapping mapping : enabled) {
            final BigDecimal share = totalPoints
                    .multiply(mapping.weight())
                    .divide(totalWeight, MathContext.DECIMAL64)
                    .setScale(POINT_SCALE, RoundingMode.HALF_UP);
            allocation.merge(mapping.skillName(), share, BigDecimal::add);
        }
        return allocation;
    }
}
