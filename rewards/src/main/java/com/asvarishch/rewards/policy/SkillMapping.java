package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.SkillCategory;

import java.math.BigDecimal;

public record SkillMapping(String skillName, BigDecimal weight, SkillCategory category, boolean enabled) {

    public static SkillMapping enabled(String skillName, String weight, SkillCategory category) {
        return new SkillMapping(skillName, new BigDecimal(weight), category, true);
    }

    public static SkillMapping disabled(String skillName, String weight, SkillCategory category) {
        return new SkillMapping(skillName, new BigDecimal(weight), category, false);
    }
}
