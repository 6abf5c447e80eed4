package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.SkillProgressionCalculator;
import com.asvarishch.rewards.dto.SkillProfileResponse;
import com.asvarishch.rewards.enums.SkillTier;
import com.asvarishch.rewards.model.TournamentParticipation;
import com.asvarishch.rewards.model.UserSkillBaseline;
import com.asvarishch.rewards.repository.SkillRewardRepository;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.UserSkillBaselineRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Current skill levels, derived on read and never stored.
 * <p>
 * For each skill the onboarding baseline (50 when none was recorded) is blended with the latest
 * tournament placement that awarded the skill, weighted by how many tournaments awarded it so far.
 * Net ledger points are reported next to it.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SkillProfileService {

    private static final int LEVEL_SCALE = 1;

    private final UserSkillBaselineRepository baselineRepository;
    private final TournamentParticipationRepository participationRepository;
    private final SkillRewardRepository skillRewardRepository;
    private final SkillProgressionCalculator calculator;

    public SkillProfileResponse getSkillProfile(Long userId) {
        final Map<String, BigDecimal> baselines = new TreeMap<>();
        for (UserSkillBaseline b : baselineRepository.findByUserId(userId)) {
            baselines.put(b.getSkillName(), b.getBaselineValue());
        }
        final Map<String, BigDecimal> ledger = new TreeMap<>();
        for (SkillRewardRepository.SkillPointsTotal t : skillRewardRepository.sumByUser(userId)) {
            ledger.put(t.getSkillName(), t.getPoints());
        }
        final List<TournamentParticipation> participations =
                participationRepository.findByUserIdOrderByDistributedAtAscParticipationIdAsc(userId);

        final TreeSet<String> skillNames = new TreeSet<>(baselines.keySet());
        skillNames.addAll(ledger.keySet());
        participations.forEach(p -> skillNames.addAll(p.getSkillPoints().keySet()));

        final Map<String, SkillProfileResponse.SkillLevel> skills = new LinkedHashMap<>();
        BigDecimal levelSum = BigDecimal.ZERO;
        for (String skill : skillNames) {
            final SkillProfileResponse.SkillLevel level = replay(skill,
                    baselines.getOrDefault(skill, SkillProgressionCalculator.DEFAULT_BASELINE),
                    participations,
                    ledger.getOrDefault(skill, BigDecimal.ZERO));
            skills.put(skill, level);
            levelSum = levelSum.add(level.currentLevel());
        }

        return SkillProfileResponse.builder()
                .userId(userId)
                .skills(skills)
                .averageLevel(skills.isEmpty()
                        ? BigDecimal.ZERO.setScale(LEVEL_SCALE)
                        : levelSum.divide(BigDecimal.valueOf(skills.size()), LEVEL_SCALE, RoundingMode.HALF_UP))
                .totalTournaments(participations.size())
                .build();
    }

    private SkillProfileResponse.SkillLevel replay(String skill,
                                                   BigDecimal baseline,
                                                   List<TournamentParticipation> participations,
                                                   BigDecimal ledgerPoints) {
        final BigDecimal start = baseline.setScale(LEVEL_SCALE, RoundingMode.HALF_UP);
        BigDecimal current = start;
        int count = 0;
        for (TournamentParticipation p : participations) {
            if (!p.getSkillPoints().containsKey(skill) || p.getTotalParticipants() < 1) {
                continue;
            }
            count++;
            current = calculator.calculate(start, p.getPlacement(), p.getTotalParticipants(), count);
        }
        return SkillProfileResponse.SkillLevel.builder()
                .baseline(start)
                .currentLevel(current)
                .tournamentDelta(current.subtract(start))
                .ledgerPoints(ledgerPoints)
                .tournamentCount(count)
                .tier(SkillTier.of(current))
                .build();
    }
}
