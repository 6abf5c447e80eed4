package com.asvarishch.rewards.enums;

/**
 * Condition attached to a configured badge; evaluated per participant at distribution time.
 */
public enum BadgeConditionType {
    ALWAYS,
    FIRST_TOURNAMENT,
    SCORE_THRESHOLD,
    PERFECT_SCORE
}
