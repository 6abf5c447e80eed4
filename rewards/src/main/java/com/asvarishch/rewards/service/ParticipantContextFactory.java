package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.BadgeAssignmentEngine;
import com.asvarishch.rewards.calculation.ParticipantContext;
import com.asvarishch.rewards.enums.SkillRewardSource;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentBadge;
import com.asvarishch.rewards.model.TournamentRanking;
import com.asvarishch.rewards.model.UserSkillBaseline;
import com.asvarishch.rewards.repository.SkillRewardRepository;
import com.asvarishch.rewards.repository.TournamentBadgeRepository;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRankingRepository;
import com.asvarishch.rewards.repository.UserSkillBaselineRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the history a participant's reward depends on. Shared by distribution and preview.
 */
@Component
@RequiredArgsConstructor
public class ParticipantContextFactory {

    private static final List<String> MILESTONE_TYPES =
            List.of(BadgeAssignmentEngine.TOURNAMENT_VETERAN, BadgeAssignmentEngine.TOURNAMENT_LEGEND);

    private final TournamentRankingRepository rankingRepository;
    private final TournamentParticipationRepository participationRepository;
    private final SkillRewardRepository skillRewardRepository;
    private final TournamentBadgeRepository badgeRepository;
    private final UserSkillBaselineRepository baselineRepository;

    /**
     * Final placements of the tournament, checked for a usable shape.
     *
     * @throws RewardValidationException if there are no rankings, a user appears twice,
     *                                   or a placement lies outside {@code 1..participants}
     */
    public List<TournamentRanking> loadValidatedRankings(Long tournamentId) {
        final List<TournamentRanking> rankings =
                rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(tournamentId);
        if (rankings.isEmpty()) {
            throw new RewardValidationException("No rankings submitted for tournamentId=" + tournamentId);
        }
        final Set<Long> users = new HashSet<>();
        for (TournamentRanking r : rankings) {
            if (!users.add(r.getUserId())) {
                throw new RewardValidationException("Duplicate userId=" + r.getUserId()
                        + " in rankings of tournamentId=" + tournamentId);
            }
            if (r.getPlacement() < 1 || r.getPlacement() > rankings.size()) {
                throw new RewardValidationException("Placement " + r.getPlacement() + " of userId=" + r.getUserId()
                        + " is outside 1.." + rankings.size());
            }
        }
        return rankings;
    }

    public ParticipantContext build(Tournament tournament, TournamentRanking ranking, int totalParticipants) {
        final Long userId = ranking.getUserId();
        final Long tournamentId = tournament.getTournamentId();

        return ParticipantContext.builder()
                .userId(userId)
                .tournamentId(tournamentId)
                .tournamentName(tournament.getName())
                .placement(ranking.getPlacement())
                .totalParticipants(totalParticipants)
                .score(ranking.getPoints())
                .priorTournamentCount((int) participationRepository.countByUserIdAndTournament_TournamentIdNot(userId, tournamentId))
                .skillBaselines(baselines(userId))
                .priorSkillTournaments(priorSkillTournaments(userId, tournamentId))
                .presentBadgeTypes(badgeRepository.findByUserIdAndTournamentIdOrderByBadgeIdAsc(userId, tournamentId).stream()
                        .map(TournamentBadge::getBadgeType)
                        .collect(Collectors.toSet()))
                .heldMilestoneTypes(new HashSet<>(badgeRepository.findHeldBadgeTypes(userId, MILESTONE_TYPES)))
                .build();
    }

    private Map<String, BigDecimal> baselines(Long userId) {
        final Map<String, BigDecimal> result = new HashMap<>();
        for (UserSkillBaseline b : baselineRepository.findByUserId(userId)) {
            result.put(b.getSkillName(), b.getBaselineValue());
        }
        return result;
    }

    private Map<String, Integer> priorSkillTournaments(Long userId, Long tournamentId) {
        final Map<String, Integer> result = new HashMap<>();
        for (SkillRewardRepository.SkillSourceCount c :
                skillRewardRepository.countSourcesPerSkill(userId, SkillRewardSource.TOURNAMENT, tournamentId)) {
            result.put(c.getSkillName(), c.getSources().intValue());
        }
        return result;
    }
}
