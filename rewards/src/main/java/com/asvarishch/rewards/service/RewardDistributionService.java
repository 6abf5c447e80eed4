package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.BadgeAward;
import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.calculation.ParticipantReward;
import com.asvarishch.rewards.calculation.RewardCalculator;
import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.ParticipantRewardDTO;
import com.asvarishch.rewards.enums.DistributionOutcome;
import com.asvarishch.rewards.enums.SkillRewardSource;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.exception.TournamentNotFoundException;
import com.asvarishch.rewards.model.SkillReward;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentParticipation;
import com.asvarishch.rewards.model.TournamentRanking;
import com.asvarishch.rewards.policy.RewardPolicy;
import com.asvarishch.rewards.policy.RewardPolicyLoader;
import com.asvarishch.rewards.policy.RewardPolicyParser;
import com.asvarishch.rewards.repository.SkillRewardRepository;
import com.asvarishch.rewards.repository.TournamentBadgeRepository;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Writes the rewards of a whole tournament in one transaction.
 * <p>
 * <ol>
 *   <li>Lock the tournament row ({@code PESSIMISTIC_WRITE}); concurrent calls for the same tournament queue here.</li>
 *   <li>State check: {@code COMPLETED} proceeds; {@code REWARDS_DISTRIBUTED} without force returns the persisted
 *       totals with a zero count; anything else is rejected.</li>
 *   <li>Load and validate the rankings (no duplicate user, placements within range) before any write.</li>
 *   <li>Load the reward policy; a malformed one is replaced by the default policy.</li>
 *   <li>Per participant:
 *       <ul>
 *           <li>existing participation and no force → skip;</li>
 *           <li>compute the reward via {@link RewardCalculator};</li>
 *           <li>upsert the participation row (replaced in place when forced);</li>
 *           <li>append ledger rows for the difference to what the ledger already holds for this tournament;</li>
 *           <li>insert badges the user does not hold yet.</li>
 *       </ul>
 *   </li>
 *   <li>Move the tournament to {@code REWARDS_DISTRIBUTED} and snapshot the effective policy.</li>
 * </ol>
 * Any exception rolls the whole distribution back. A unique-constraint race is handled by the caller,
 * {@link TournamentRewardOrchestrator}, once this transaction is gone.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RewardDistributionService {

    private final TournamentRepository tournamentRepository;
    private final TournamentParticipationRepository participationRepository;
    private final SkillRewardRepository skillRewardRepository;
    private final TournamentBadgeRepository badgeRepository;
    private final ParticipantContextFactory contextFactory;
    private final RewardPolicyLoader policyLoader;
    private final RewardPolicyParser policyParser;
    private final RewardCalculator rewardCalculator;
    private final RewardQueryService queryService;
    private final Clock clock;

    /**
     * @param tournamentId        tournament to reward
     * @param forceRedistribution overwrite rewards that already exist instead of skipping them
     * @param distributedBy       free-text actor recorded on each participation, may be null
     * @return totals of what this call wrote; a zero count when nothing was written
     * @throws TournamentNotFoundException if the tournament does not exist
     * @throws RewardValidationException   if the tournament is not in a distributable state or the rankings are unusable
     */
    @Transactional
    public DistributionSummary distribute(Long tournamentId, boolean forceRedistribution, String distributedBy) {
        // --- 1) Lock tournament ---
        final Tournament tournament = tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> new TournamentNotFoundException(tournamentId));

        // --- 2) Source state ---
        final Optional<DistributionSummary> alreadyDistributed = alreadyDistributedResponse(tournament, forceRedistribution);
        if (alreadyDistributed.isPresent()) {
            return alreadyDistributed.get();
        }

        // --- 3) Rankings, validated before any write ---
        final List<TournamentRanking> rankings = contextFactory.loadValidatedRankings(tournamentId);

        // --- 4) Policy ---
        final RewardPolicy policy = policyLoader.load(tournament);

        // --- 5) Per participant ---
        final Instant now = clock.instant();
        final List<ParticipantRewardDTO> written = new ArrayList<>();
        long totalXp = 0;
        long totalCredits = 0;
        int totalBadges = 0;
        int overwritten = 0;

        for (TournamentRanking ranking : rankings) {
            final Optional<TournamentParticipation> existing =
                    participationRepository.findByTournament_TournamentIdAndUserId(tournamentId, ranking.getUserId());
            if (existing.isPresent() && !forceRedistribution) {
                log.info("[DIST] Skipping userId={} in tournamentId={}: rewards already recorded",
                        ranking.getUserId(), tournamentId);
                continue;
            }

            final ParticipantContext context = contextFactory.build(tournament, ranking, rankings.size());
            final ParticipantReward reward = rewardCalculator.calculate(policy, context);

            upsertParticipation(existing.orElse(null), tournament, reward, rankings.size(), now, distributedBy);
            appendLedger(reward, tournamentId);
            saveBadges(reward, tournamentId);

            if (existing.isPresent()) {
                overwritten++;
            }
            totalXp += reward.totalXp();
            totalCredits += reward.credits();
            totalBadges += reward.badges().size();
            written.add(RewardMapper.toDto(reward, tournamentId));
        }

        // --- 6) Tournament state and policy snapshot ---
        tournament.markRewardsDistributed(policyParser.toJson(policy), now);
        tournamentRepository.save(tournament);

        final DistributionOutcome outcome = outcomeOf(written.size(), overwritten);
        log.info("[DIST] tournamentId={} outcome={} participants={} written={} overwritten={} xp={} credits={} badges={} policy={}",
                tournamentId, outcome, rankings.size(), written.size(), overwritten, totalXp, totalCredits, totalBadges,
                policy.templateName());

        return DistributionSummary.builder()
                .tournamentId(tournamentId)
                .outcome(outcome)
                .rewardsDistributedCount(written.size())
                .totalXpAwarded(totalXp)
                .totalCreditsAwarded(totalCredits)
                .totalBadgesAwarded(totalBadges)
                .forced(forceRedistribution)
                .distributedAt(now)
                .message(messageOf(outcome, overwritten))
                .rewards(written)
                .build();
    }

    /**
     * Empty when the distribution should go ahead; the persisted totals when it is a repeat.
     */
    private Optional<DistributionSummary> alreadyDistributedResponse(Tournament tournament, boolean force) {
        final TournamentStatus status = tournament.getStatus();
        if (status == TournamentStatus.COMPLETED) {
            return Optional.empty();
        }
        if (status == TournamentStatus.REWARDS_DISTRIBUTED) {
            if (force) {
                log.info("[DIST] Forced redistribution requested for tournamentId={}", tournament.getTournamentId());
                return Optional.empty();
            }
            log.info("[DIST] Rewards already distributed for tournamentId={} at {}; nothing to do",
                    tournament.getTournamentId(), tournament.getRewardsDistributedAt());
            return Optional.of(queryService.persistedSummary(tournament, "Rewards were already distributed."));
        }
        throw new RewardValidationException("Tournament " + tournament.getTournamentId()
                + " must be COMPLETED to distribute rewards, current status: " + status);
    }

    private void upsertParticipation(TournamentParticipation existing,
                                     Tournament tournament,
                                     ParticipantReward reward,
                                     int totalParticipants,
                                     Instant now,
                                     String distributedBy) {
        final TournamentParticipation participation = existing != null
                ? existing
                : TournamentParticipation.builder()
                .userId(reward.userId())
                .tournament(tournament)
                .redistributionCount(0)
                .build();
        if (existing != null) {
            participation.setRedistributionCount(existing.getRedistributionCount() + 1);
        }
        participation.setPlacement(reward.placement());
        participation.setTotalParticipants(totalParticipants);
        participation.setSkillPoints(new LinkedHashMap<>(reward.skillPoints()));
        participation.setSkillRatingDeltas(new LinkedHashMap<>(reward.skillRatingDeltas()));
        participation.setBaseXp(reward.baseXp());
        participation.setBonusXp(reward.bonusXp());
        participation.setTotalXp(reward.totalXp());
        participation.setCredits(reward.credits());
        participation.setDistributedAt(now);
        participation.setDistributedBy(distributedBy);
        participationRepository.save(participation);
    }

    /**
     * Ledger rows are never edited: for each skill the signed difference between the new award and
     * the ledger's running total for this tournament is appended, so the total always equals the award.
     */
    private void appendLedger(ParticipantReward reward, Long tournamentId) {
        final Map<String, BigDecimal> recorded = new LinkedHashMap<>();
        for (SkillRewardRepository.SkillPointsTotal t :
                skillRewardRepository.sumBySource(reward.userId(), SkillRewardSource.TOURNAMENT, tournamentId)) {
            recorded.put(t.getSkillName(), t.getPoints());
        }

        final Set<String> skills = new LinkedHashSet<>(reward.skillPoints().keySet());
        skills.addAll(recorded.keySet());

        for (String skill : skills) {
            final BigDecimal awarded = reward.skillPoints().getOrDefault(skill, BigDecimal.ZERO);
            final BigDecimal delta = awarded.subtract(recorded.getOrDefault(skill, BigDecimal.ZERO));
            if (delta.signum() == 0) {
                continue;
            }
            skillRewardRepository.save(SkillReward.builder()
                    .userId(reward.userId())
                    .sourceType(SkillRewardSource.TOURNAMENT)
                    .sourceId(tournamentId)
                    .skillName(skill)
                    .pointsAwarded(delta)
                    .build());
        }
    }

    private void saveBadges(ParticipantReward reward, Long tournamentId) {
        for (BadgeAward award : reward.badges()) {
            badgeRepository.save(RewardMapper.toEntity(award, reward.userId(), tournamentId));
        }
    }

    private static DistributionOutcome outcomeOf(int written, int overwritten) {
        if (written == 0) {
            return DistributionOutcome.ALREADY_DISTRIBUTED;
        }
        return overwritten > 0 ? DistributionOutcome.REDISTRIBUTED : DistributionOutcome.DISTRIBUTED;
    }

    private static String messageOf(DistributionOutcome outcome, int overwritten) {
        return switch (outcome) {
            case DISTRIBUTED -> "Rewards distributed.";
            case REDISTRIBUTED -> "Rewards redistributed: " + overwritten + " existing reward record(s) overwritten.";
            case ALREADY_DISTRIBUTED -> "All participants already had rewards; nothing written.";
            case PREVIEW -> "Preview only; nothing written.";
        };
    }
}
