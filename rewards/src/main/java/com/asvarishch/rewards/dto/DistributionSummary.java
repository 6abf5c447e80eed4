package com.asvarishch.rewards.dto;

import com.asvarishch.rewards.enums.DistributionOutcome;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Result of a distribution (or preview) for a whole tournament.
 * {@code rewardsDistributedCount} is 0 when nothing was written.
 */
@Builder
public record DistributionSummary(
        Long tournamentId,
        DistributionOutcome outcome,
        int rewardsDistributedCount,
        long totalXpAwarded,
        long totalCreditsAwarded,
        int totalBadgesAwarded,
        boolean forced,
        Instant distributedAt,
        String message,
        List<ParticipantRewardDTO> rewards
) {
}
