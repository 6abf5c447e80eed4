package com.asvarishch.rewards.service;

import com.asvarishch.rewards.config.RewardProperties;
import com.asvarishch.rewards.dto.BadgeShowcaseResponse;
import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.ParticipantRewardDTO;
import com.asvarishch.rewards.dto.UserRewardResponse;
import com.asvarishch.rewards.enums.BadgeCategory;
import com.asvarishch.rewards.enums.DistributionOutcome;
import com.asvarishch.rewards.exception.RewardNotFoundException;
import com.asvarishch.rewards.exception.TournamentNotFoundException;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentBadge;
import com.asvarishch.rewards.model.TournamentParticipation;
import com.asvarishch.rewards.repository.TournamentBadgeRepository;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Read-only views over persisted rewards.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RewardQueryService {

    static final int TOP_BADGES_PER_CATEGORY = 3;

    // Rarest first; among equals the most recent first.
    static final Comparator<TournamentBadge> RAREST_FIRST = Comparator
            .comparing(TournamentBadge::getRarity, Comparator.reverseOrder())
            .thenComparing(TournamentBadge::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(TournamentBadge::getBadgeId, Comparator.nullsLast(Comparator.reverseOrder()));

    private final TournamentRepository tournamentRepository;
    private final TournamentParticipationRepository participationRepository;
    private final TournamentBadgeRepository badgeRepository;
    private final RewardProperties properties;

    public UserRewardResponse getUserReward(Long tournamentId, Long userId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw new TournamentNotFoundException(tournamentId);
        }
        final TournamentParticipation participation = participationRepository
                .findByTournament_TournamentIdAndUserId(tournamentId, userId)
                .orElseThrow(() -> new RewardNotFoundException(tournamentId, userId));
        final List<TournamentBadge> badges = badgeRepository.findByUserIdAndTournamentIdOrderByBadgeIdAsc(userId, tournamentId);

        return UserRewardResponse.builder()
                .tournamentId(tournamentId)
                .userId(userId)
                .placement(participation.getPlacement())
                .baseXp(participation.getBaseXp())
                .bonusXp(participation.getBonusXp())
                .totalXp(participation.getTotalXp())
                .credits(participation.getCredits())
                .skillPoints(participation.getSkillPoints())
                .skillRatingDeltas(participation.getSkillRatingDeltas())
                .distributedAt(participation.getDistributedAt())
                .distributedBy(participation.getDistributedBy())
                .redistributionCount(participation.getRedistributionCount())
                .badges(badges.stream().map(RewardMapper::toDto).toList())
                .rarestBadge(badges.stream().min(RAREST_FIRST).map(RewardMapper::toDto).orElse(null))
                .build();
    }

    /**
     * Badge sections of a user's profile: rarest, most recent, and per category with its top three.
     */
    public BadgeShowcaseResponse getBadgeShowcase(Long userId) {
        final List<TournamentBadge> badges = badgeRepository.findByUserIdOrderByCreatedAtDescBadgeIdDesc(userId);
        final int limit = properties.showcaseLimit();

        final Map<BadgeCategory, List<TournamentBadge>> grouped = badges.stream()
                .collect(Collectors.groupingBy(TournamentBadge::getCategory,
                        () -> new EnumMap<>(BadgeCategory.class), Collectors.toList()));

        final Map<BadgeCategory, BadgeShowcaseResponse.CategorySection> byCategory = new EnumMap<>(BadgeCategory.class);
        grouped.forEach((category, list) -> byCategory.put(category, new BadgeShowcaseResponse.CategorySection(
                list.size(),
                list.stream().sorted(RAREST_FIRST).limit(TOP_BADGES_PER_CATEGORY).map(RewardMapper::toDto).toList())));

        return BadgeShowcaseResponse.builder()
                .userId(userId)
                .totalBadges(badges.size())
                .rarestBadges(badges.stream().sorted(RAREST_FIRST).limit(limit).map(RewardMapper::toDto).toList())
                .recentBadges(badges.stream().limit(limit).map(RewardMapper::toDto).toList())
                .byCategory(byCategory)
                .build();
    }

    /** Totals of what is already persisted for the tournament, reported with a zero count. */
    public DistributionSummary getPersistedSummary(Long tournamentId, String message) {
        final Tournament tournament = tournamentRepository.findById(tournamentId)
                .orElseThrow(() -> new TournamentNotFoundException(tournamentId));
        return persistedSummary(tournament, message);
    }

    public DistributionSummary persistedSummary(Tournament tournament, String message) {
        final Long tournamentId = tournament.getTournamentId();
        final List<TournamentParticipation> participations = participationRepository.findByTournament_TournamentId(tournamentId);

        final List<ParticipantRewardDTO> rewards = participations.stream()
                .sorted(Comparator.comparingInt(TournamentParticipation::getPlacement))
                .map(p -> RewardMapper.toDto(p,
                        badgeRepository.findByUserIdAndTournamentIdOrderByBadgeIdAsc(p.getUserId(), tournamentId)))
                .toList();

        return DistributionSummary.builder()
                .tournamentId(tournamentId)
                .outcome(DistributionOutcome.ALREADY_DISTRIBUTED)
                .rewardsDistributedCount(0)
                .totalXpAwarded(participations.stream().mapToLong(TournamentParticipation::getTotalXp).sum())
                .totalCreditsAwarded(participations.stream().mapToLong(TournamentParticipation::getCredits).sum())
                .totalBadgesAwarded((int) badgeRepository.countByTournamentId(tournamentId))
                .forced(false)
                .distributedAt(tournament.getRewardsDistributedAt())
                .message(message)
                .rewards(rewards)
                .build();
    }
}
