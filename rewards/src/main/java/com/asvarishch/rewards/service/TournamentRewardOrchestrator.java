package com.asvarishch.rewards.service;

import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.RewardsDistributedEvent;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.kafka.RewardEventProducer;
import com.asvarishch.rewards.model.TournamentParticipation;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRankingRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Entry point for reward distribution, used by REST and Kafka alike.
 * <p>
 * Runs outside a transaction so it can inspect what the transactional {@link RewardDistributionService}
 * throws at commit. A unique-constraint violation is answered with the persisted result only when the
 * stored state shows that another call distributed every ranked participant; any other integrity
 * failure is rethrown, and the rolled back transaction leaves nothing behind.
 * A {@code rewards-distributed} event is published once rewards were actually written.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TournamentRewardOrchestrator {

    private final RewardDistributionService distributionService;
    private final RewardQueryService queryService;
    private final RewardEventProducer eventProducer;
    private final TournamentRepository tournamentRepository;
    private final TournamentRankingRepository rankingRepository;
    private final TournamentParticipationRepository participationRepository;

    public DistributionSummary distributeRewards(Long tournamentId, boolean forceRedistribution, String distributedBy) {
        final DistributionSummary summary;
        try {
            summary = distributionService.distribute(tournamentId, forceRedistribution, distributedBy);
        } catch (DataIntegrityViolationException e) {
            // forced runs hold the tournament lock throughout, they cannot lose a race
            if (forceRedistribution || !distributedConcurrently(tournamentId)) {
                log.error("[DIST] Reward write failed for tournamentId={}, nothing was persisted: {}",
                        tournamentId, e.getMostSpecificCause().getMessage());
                throw e;
            }
            log.warn("[DIST] Concurrent distribution detected for tournamentId={}, returning persisted rewards: {}",
                    tournamentId, e.getMostSpecificCause().getMessage());
            return queryService.getPersistedSummary(tournamentId,
                    "Rewards were distributed by a concurrent request.");
        }

        if (summary.rewardsDistributedCount() > 0) {
            eventProducer.send(RewardsDistributedEvent.from(summary));
        }
        return summary;
    }

    private boolean distributedConcurrently(Long tournamentId) {
        final boolean distributed = tournamentRepository.findById(tournamentId)
                .map(t -> t.getStatus() == TournamentStatus.REWARDS_DISTRIBUTED)
                .orElse(false);
        if (!distributed) {
            return false;
        }
        final Set<Long> rewarded = participationRepository.findByTournament_TournamentId(tournamentId).stream()
                .map(TournamentParticipation::getUserId)
                .collect(Collectors.toSet());
        return rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(tournamentId).stream()
                .allMatch(r -> rewarded.contains(r.getUserId()));
    }
}
