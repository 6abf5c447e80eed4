package com.asvarishch.rewards.enums;

public enum SkillRewardSource {
    TOURNAMENT,
    TRAINING,
    ASSESSMENT
}
