package com.asvarishch.rewards.enums;

public enum BadgeCategory {
    PLACEMENT,
    PARTICIPATION,
    ACHIEVEMENT,
    MILESTONE
}
