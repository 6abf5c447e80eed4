package com.asvarishch.rewards.dto;

import com.asvarishch.rewards.enums.DistributionOutcome;
import lombok.Builder;

import java.time.Instant;

@Builder
public record RewardsDistributedEvent(
        Long tournamentId,
        DistributionOutcome outcome,
        int rewardsDistributedCount,
        long totalXpAwarded,
        long totalCreditsAwarded,
        int totalBadgesAwarded,
        Instant distributedAt
) {

    public static RewardsDistributedEvent from(DistributionSummary summary) {
        return RewardsDistributedEvent.builder()
                .tournamentId(summary.tournamentId())
                .outcome(summary.outcome())
                .rewardsDistributedCount(summary.rewardsDistributedCount())
                .totalXpAwarded(summary.totalXpAwarded())
                .totalCreditsAwarded(summary.totalCreditsAwarded())
                .totalBadgesAwarded(summary.totalBadgesAwarded())
                .distributedAt(summary.distributedAt())
                .build();
    }
}
