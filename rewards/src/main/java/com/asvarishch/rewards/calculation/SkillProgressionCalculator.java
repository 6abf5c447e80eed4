package com.asvarishch.rewards.calculation;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Placement-based skill progression.
 * <p>
 * The placement is mapped linearly onto {@code [MIN_SKILL_VALUE, MAX_SKILL_CAP]} (1st place = cap,
 * last place = min) and blended with the baseline as a converging weighted average:
 * <pre>
 *   baseline_weight  = 1 / (n + 1)
 *   placement_weight = n / (n + 1)
 *   base_new = baseline * baseline_weight + placement_value * placement_weight
 *   final    = clamp(baseline + (base_new - baseline) * weight_multiplier, MIN, CAP)
 * </pre>
 * where {@code n} is the number of tournaments that count for the skill, this one included.
 * A poor placement can lower the value.
 */
@Component
public class SkillProgressionCalculator {

    public static final BigDecimal MIN_SKILL_VALUE = new BigDecimal("40");
    public static final BigDecimal MAX_SKILL_CAP = new BigDecimal("100");
    public static final BigDecimal DEFAULT_BASELINE = new BigDecimal("50");

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final int VALUE_SCALE = 1;

    public BigDecimal calculate(BigDecimal baseline, int placement, int totalParticipants, int tournamentCount) {
        return calculate(baseline, placement, totalParticipants, tournamentCount, BigDecimal.ONE);
    }

    public BigDecimal calculate(BigDecimal baseline,
                                int placement,
                                int totalParticipants,
                                int tournamentCount,
                                BigDecimal weightMultiplier) {
        if (tournamentCount < 0) {
            throw new IllegalArgumentException("tournamentCount must not be negative");
        }
        final BigDecimal start = baseline != null ? baseline : DEFAULT_BASELINE;
        final BigDecimal multiplier = weightMultiplier != null ? weightMultiplier : BigDecimal.ONE;

        final BigDecimal placementValue = placementValue(placement, totalParticipants);
        final BigDecimal n = BigDecimal.valueOf(tournamentCount);
        final BigDecimal denominator = n.add(BigDecimal.ONE);
        final BigDecimal baselineWeight = BigDecimal.ONE.divide(denominator, MC);
        final BigDecimal placementWeight = n.divide(denominator, MC);

        final BigDecimal baseNew = start.multiply(baselineWeight, MC).add(placementValue.multiply(placementWeight, MC));
        final BigDecimal delta = baseNew.subtract(start);
        final BigDecimal adjusted = start.add(delta.multiply(multiplier, MC));

        return clamp(adjusted).setScale(VALUE_SCALE, RoundingMode.HALF_UP);
    }

    /** Linear placement value, {@link #MAX_SKILL_CAP} for the winner down to {@link #MIN_SKILL_VALUE} for last place. */
    public BigDecimal placementValue(int placement, int totalParticipants) {
        if (totalParticipants < 1) {
            throw new IllegalArgumentException("totalParticipants must be positive");
        }
        if (placement < 1 || placement > totalParticipants) {
            throw new IllegalArgumentException(
                    "placement must be within 1.." + totalParticipants + ", got " + placement);
        }
        if (totalParticipants == 1) {
            return MAX_SKILL_CAP;
        }
        final BigDecimal percentile = BigDecimal.valueOf(placement - 1L)
                .divide(BigDecimal.valueOf(totalParticipants - 1L), MC);
        return MAX_SKILL_CAP.subtract(percentile.multiply(MAX_SKILL_CAP.subtract(MIN_SKILL_VALUE), MC));
    }

    private static BigDecimal clamp(BigDecimal value) {
        if (value.compareTo(MIN_SKILL_VALUE) < 0) {
            return MIN_SKILL_VALUE;
        }
        if (value.compareTo(MAX_SKILL_CAP) > 0) {
            return MAX_SKILL_CAP;
        }
        return value;
    }
}
