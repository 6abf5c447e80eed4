package com.asvarishch.rewards.enums;

public enum TournamentStatus {
    DRAFT,
    ENROLLMENT_OPEN,
    IN_PROGRESS,
    COMPLETED,
    REWARDS_DISTRIBUTED,
    CANCELLED
}
