package com.asvarishch.rewards.enums;

public enum SkillCategory {
    PHYSICAL,
    TECHNICAL,
    TACTICAL,
    MENTAL
}
