package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.BadgeAward;
import com.asvarishch.rewards.calculation.ParticipantReward;
import com.asvarishch.rewards.dto.BadgeDTO;
import com.asvarishch.rewards.dto.ParticipantRewardDTO;
import com.asvarishch.rewards.model.TournamentBadge;
import com.asvarishch.rewards.model.TournamentParticipation;

import java.util.LinkedHashMap;
import java.util.List;

final class RewardMapper {

    private RewardMapper() {
    }

    static BadgeDTO toDto(TournamentBadge badge) {
        return BadgeDTO.builder()
                .tournamentId(badge.getTournamentId())
                .badgeType(badge.getBadgeType())
                .category(badge.getCategory())
                .title(badge.getTitle())
                .description(badge.getDescription())
                .icon(badge.getIcon())
                .rarity(badge.getRarity())
                .metadata(badge.getMetadata())
                .awardedAt(badge.getCreatedAt())
                .build();
    }

    static BadgeDTO toDto(BadgeAward award, Long tournamentId) {
        return BadgeDTO.builder()
                .tournamentId(tournamentId)
                .badgeType(award.badgeType())
                .category(award.category())
                .title(award.title())
                .description(award.description())
                .icon(award.icon())
                .rarity(award.rarity())
                .metadata(award.metadata())
                .build();
    }

    static ParticipantRewardDTO toDto(ParticipantReward reward, Long tournamentId) {
        return ParticipantRewardDTO.builder()
                .userId(reward.userId())
                .placement(reward.placement())
                .baseXp(reward.baseXp())
                .bonusXp(reward.bonusXp())
                .totalXp(reward.totalXp())
                .credits(reward.credits())
                .skillPoints(reward.skillPoints())
                .skillRatingDeltas(reward.skillRatingDeltas())
                .badges(reward.badges().stream().map(b -> toDto(b, tournamentId)).toList())
                .build();
    }

    static ParticipantRewardDTO toDto(TournamentParticipation participation, List<TournamentBadge> badges) {
        return ParticipantRewardDTO.builder()
                .userId(participation.getUserId())
                .placement(participation.getPlacement())
                .baseXp(participation.getBaseXp())
                .bonusXp(participation.getBonusXp())
                .totalXp(participation.getTotalXp())
                .credits(participation.getCredits())
                .skillPoints(participation.getSkillPoints())
                .skillRatingDeltas(participation.getSkillRatingDeltas())
                .badges(badges.stream().map(RewardMapper::toDto).toList())
                .build();
    }

    static TournamentBadge toEntity(BadgeAward award, Long userId, Long tournamentId) {
        return TournamentBadge.builder()
                .userId(userId)
                .tournamentId(tournamentId)
                .badgeType(award.badgeType())
                .category(award.category())
                .title(award.title())
                .description(award.description())
                .icon(award.icon())
                .rarity(award.rarity())
                .metadata(new LinkedHashMap<>(award.metadata()))
                .build();
    }
}
