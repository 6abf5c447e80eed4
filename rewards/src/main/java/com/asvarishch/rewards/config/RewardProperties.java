package com.asvarishch.rewards.config;

import com.asvarishch.rewards.enums.SkillCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Engine-wide reward settings.
 *
 * @param xpPerSkillPoint bonus XP granted per skill point, by skill category
 * @param defaultTemplate template used when a tournament has no usable policy
 * @param showcaseLimit   size of the rarest / most recent lists of the badge showcase
 */
@ConfigurationProperties(prefix = "rewards")
public record RewardProperties(
        Map<SkillCategory, Integer> xpPerSkillPoint,
        String defaultTemplate,
        int showcaseLimit) {

    public RewardProperties {
        final Map<SkillCategory, Integer> rates = new EnumMap<>(defaultRates());
        if (xpPerSkillPoint != null) {
            rates.putAll(xpPerSkillPoint);
        }
        xpPerSkillPoint = Map.copyOf(rates);
        if (defaultTemplate == null || defaultTemplate.isBlank()) {
            defaultTemplate = "STANDARD";
        }
        if (showcaseLimit <= 0) {
            showcaseLimit = 5;
        }
    }

    public static RewardProperties defaults() {
        return new RewardProperties(null, null, 0);
    }

    public int xpRate(SkillCategory category) {
        return xpPerSkillPoint.getOrDefault(category, 10);
    }

    private static Map<SkillCategory, Integer> defaultRates() {
        return Map.of(
                SkillCategory.PHYSICAL, 8,
                SkillCategory.TECHNICAL, 10,
                SkillCategory.TACTICAL, 10,
                SkillCategory.MENTAL, 12);
    }
}
