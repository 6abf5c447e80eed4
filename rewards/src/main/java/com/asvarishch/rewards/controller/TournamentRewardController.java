package com.asvarishch.rewards.controller;

import com.asvarishch.rewards.dto.DistributeRewardsRequest;
import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.UserRewardResponse;
import com.asvarishch.rewards.service.RewardPreviewService;
import com.asvarishch.rewards.service.RewardQueryService;
import com.asvarishch.rewards.service.TournamentRewardOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/tournaments/{tournamentId}/rewards/distribute
 * Body (optional): { "forceRedistribution": false, "distributedBy": "admin" }
 * Returns the distribution summary.
 * <p>
 * Idempotent: a repeated call returns the persisted totals with {@code rewardsDistributedCount = 0}.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tournaments/{tournamentId}/rewards")
public class TournamentRewardController {

    private final TournamentRewardOrchestrator orchestrator;
    private final RewardPreviewService previewService;
    private final RewardQueryService queryService;

    @PostMapping("/distribute")
    public ResponseEntity<DistributionSummary> distribute(@PathVariable Long tournamentId,
                                                          @Valid @RequestBody(required = false) DistributeRewardsRequest request) {
        final boolean force = request != null && request.forceRedistribution();
        final String distributedBy = request != null ? request.distributedBy() : null;
        log.info("Distribute request: tournamentId={}, force={}, by={}", tournamentId, force, distributedBy);
        return ResponseEntity.ok(orchestrator.distributeRewards(tournamentId, force, distributedBy));
    }

    @GetMapping("/preview")
    public ResponseEntity<DistributionSummary> preview(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(previewService.preview(tournamentId));
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<UserRewardResponse> userReward(@PathVariable Long tournamentId, @PathVariable Long userId) {
        return ResponseEntity.ok(queryService.getUserReward(tournamentId, userId));
    }
}
