package com.asvarishch.rewards.controller;

import com.asvarishch.rewards.dto.RankingsResponse;
import com.asvarishch.rewards.dto.SubmitRankingsRequest;
import com.asvarishch.rewards.service.TournamentRankingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /api/tournaments/{tournamentId}/rankings
 * Body: { "rankings": [ { "userId": 1, "rank": 1, "points": 95 }, ... ] }
 * <p>
 * Replaces the final placements while the tournament is COMPLETED.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/tournaments/{tournamentId}/rankings")
public class TournamentRankingController {

    private final TournamentRankingService rankingService;

    @PostMapping
    public ResponseEntity<RankingsResponse> submit(@PathVariable Long tournamentId,
                                                   @Valid @RequestBody SubmitRankingsRequest request) {
        return ResponseEntity.ok(rankingService.submitRankings(tournamentId, request.rankings()));
    }

    @GetMapping
    public ResponseEntity<RankingsResponse> get(@PathVariable Long tournamentId) {
        return ResponseEntity.ok(rankingService.getRankings(tournamentId));
    }
}
