package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.ParticipantReward;
import com.asvarishch.rewards.calculation.RewardCalculator;
import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.ParticipantRewardDTO;
import com.asvarishch.rewards.enums.DistributionOutcome;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.exception.TournamentNotFoundException;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentRanking;
import com.asvarishch.rewards.policy.RewardPolicy;
import com.asvarishch.rewards.policy.RewardPolicyLoader;
import com.asvarishch.rewards.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Dry run of a distribution: same computation, nothing written, no lock taken.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardPreviewService {

    private final TournamentRepository tournamentRepository;
    private final ParticipantContextFactory contextFactory;
    private final RewardPolicyLoader policyLoader;
    private final RewardCalculator rewardCalculator;

    @Transactional(readOnly = true)
    public DistributionSummary preview(Long tournamentId) {
        final Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new TournamentNotFoundException(tournamentId));
        if (tournament.getStatus() != TournamentStatus.COMPLETED
                && tournament.getStatus() != TournamentStatus.REWARDS_DISTRIBUTED) {
            throw new RewardValidationException("Tournament " + tournamentId
                    + " has no final placements yet, current status: " + tournament.getStatus());
        }

        final List<TournamentRanking> rankings = contextFactory.loadValidatedRankings(tournamentId);
        final RewardPolicy policy = policyLoader.load(tournament);

        final List<ParticipantRewardDTO> rewards = new ArrayList<>();
        long totalXp = 0;
        long totalCredits = 0;
        int totalBadges = 0;
        for (TournamentRanking ranking : rankings) {
            final ParticipantReward reward = rewardCalculator.calculate(
                    policy, contextFactory.build(tournament, ranking, rankings.size()));
            totalXp += reward.totalXp();
            totalCredits += reward.credits();
            totalBadges += reward.badges().size();
            rewards.add(RewardMapper.toDto(reward, tournamentId));
        }

        log.info("[PREVIEW] tournamentId={} participants={} xp={} credits={} badges={} policy={}",
                tournamentId, rankings.size(), totalXp, totalCredits, totalBadges, policy.templateName());

        return DistributionSummary.builder()
                .tournamentId(tournamentId)
                .outcome(DistributionOutcome.PREVIEW)
                .rewardsDistributedCount(rewards.size())
                .totalXpAwarded(totalXp)
                .totalCreditsAwarded(totalCredits)
                .totalBadgesAwarded(totalBadges)
                .forced(false)
                .message("Preview only; nothing written.")
                .rewards(rewards)
                .build();
    }
}
