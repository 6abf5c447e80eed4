package com.asvarishch.rewards.service;

import com.asvarishch.rewards.calculation.BadgeAssignmentEngine;
import com.asvarishch.rewards.calculation.RewardCalculator;
import com.asvarishch.rewards.calculation.SkillPointDistributor;
import com.asvarishch.rewards.calculation.SkillProgressionCalculator;
import com.asvarishch.rewards.config.RewardsConfig;
import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.RankingEntryDTO;
import com.asvarishch.rewards.enums.DistributionOutcome;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.kafka.RewardEventProducer;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentBadge;
import com.asvarishch.rewards.policy.RewardPolicyLoader;
import com.asvarishch.rewards.policy.RewardPolicyParser;
import com.asvarishch.rewards.repository.SkillRewardRepository;
import com.asvarishch.rewards.repository.TournamentBadgeRepository;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import com.asvarishch.rewards.strategy.BadgeConditionResolver;
import com.asvarishch.rewards.strategy.impl.AlwaysCondition;
import com.asvarishch.rewards.strategy.impl.FirstTournamentCondition;
import com.asvarishch.rewards.strategy.impl.PerfectScoreCondition;
import com.asvarishch.rewards.strategy.impl.ScoreThresholdCondition;
import com.asvarishch.rewards.util.JsonConfigHelper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Distribution through the orchestrator with real commits and rollbacks, so the test runs outside
 * the usual per-test transaction and cleans the tables itself.
 */
@DataJpaTest(properties = {
        "spring.sql.init.mode=never",
})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({
        RewardsConfig.class,
        JsonConfigHelper.class,
        RewardPolicyParser.class,
        RewardPolicyLoader.class,
        SkillPointDistributor.class,
        SkillProgressionCalculator.class,
        BadgeConditionResolver.class,
        AlwaysCondition.class,
        FirstTournamentCondition.class,
        ScoreThresholdCondition.class,
        PerfectScoreCondition.class,
        BadgeAssignmentEngine.class,
        RewardCalculator.class,
        ParticipantContextFactory.class,
        RewardQueryService.class,
        RewardDistributionService.class,
        TournamentRankingService.class,
        TournamentRewardOrchestrator.class
})
class RewardDistributionRollbackTest {

    private static final String SKILLS = """
            "skill_mappings": [
              {"skill": "speed", "weight": 4.0, "category": "PHYSICAL", "enabled": true},
              {"skill": "agility", "weight": 3.0, "category": "PHYSICAL", "enabled": true}
            ]""";

    @MockBean private RewardEventProducer eventProducer;

    @Autowired private TournamentRewardOrchestrator orchestrator;
    @Autowired private TournamentRankingService rankingService;
    @Autowired private TournamentRepository tournamentRepository;
    @Autowired private TournamentParticipationRepository participationRepository;
    @Autowired private SkillRewardRepository skillRewardRepository;
    @Autowired private TournamentBadgeRepository badgeRepository;
    @Autowired private JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanUp() {
        jdbcTemplate.execute("ALTER TABLE tournament_badges DROP CONSTRAINT IF EXISTS ck_badge_not_third_place");
        jdbcTemplate.update("DELETE FROM tournament_badges");
        jdbcTemplate.update("DELETE FROM skill_rewards");
        jdbcTemplate.update("DELETE FROM tournament_participations");
        jdbcTemplate.update("DELETE FROM tournament_rankings");
        jdbcTemplate.update("DELETE FROM tournaments");
    }

    private Long completedTournament(String rewardConfig) {
        Tournament t = tournamentRepository.save(Tournament.builder()
                .name("Spring Cup")
                .status(TournamentStatus.COMPLETED)
                .rewardTemplate("STANDARD")
                .rewardConfig(rewardConfig)
                .build());
        rankingService.submitRankings(t.getTournamentId(), List.of(
                new RankingEntryDTO(101L, 1, 100),
                new RankingEntryDTO(102L, 2, 92),
                new RankingEntryDTO(103L, 3, 85),
                new RankingEntryDTO(104L, 4, 80)));
        return t.getTournamentId();
    }

    @Test
    @DisplayName("Write failure at the third participant rolls everything back and is reported as an error")
    void failureMidwayLeavesNothingBehind() {
        Long tournamentId = completedTournament("{" + SKILLS + "}");
        jdbcTemplate.execute("ALTER TABLE tournament_badges ADD CONSTRAINT ck_badge_not_third_place "
                + "CHECK (badge_type <> 'THIRD_PLACE')");

        assertThatThrownBy(() -> orchestrator.distributeRewards(tournamentId, false, "organizer"))
                .isInstanceOf(DataIntegrityViolationException.class);

        assertThat(participationRepository.findByTournament_TournamentId(tournamentId)).isEmpty();
        assertThat(skillRewardRepository.count()).isZero();
        assertThat(badgeRepository.countByTournamentId(tournamentId)).isZero();
        Tournament reloaded = tournamentRepository.findById(tournamentId).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(TournamentStatus.COMPLETED);
        assertThat(reloaded.getRewardsDistributedAt()).isNull();
        verifyNoInteractions(eventProducer);
    }

    @Test
    @DisplayName("Badge title too long for storage -> default policy is used and distribution succeeds")
    void overlongBadgeTitleFallsBackToDefaultPolicy() {
        String config = "{" + SKILLS + ", \"participation\": {\"badges\": [{\"badge_type\": \"LONG_TITLE\", \"title\": \""
                + "x".repeat(200) + "\"}]}}";
        Long tournamentId = completedTournament(config);

        DistributionSummary summary = orchestrator.distributeRewards(tournamentId, false, "organizer");

        assertThat(summary.outcome()).isEqualTo(DistributionOutcome.DISTRIBUTED);
        assertThat(summary.rewardsDistributedCount()).isEqualTo(4);
        assertThat(tournamentRepository.findById(tournamentId).orElseThrow().getStatus())
                .isEqualTo(TournamentStatus.REWARDS_DISTRIBUTED);
        List<TournamentBadge> badges = badgeRepository.findAll();
        assertThat(badges).isNotEmpty().noneMatch(b -> "LONG_TITLE".equals(b.getBadgeType()));
        assertThat(badges).allSatisfy(b -> assertThat(b.getTitle().length()).isLessThanOrEqualTo(120));
        verify(eventProducer).send(any());
    }
}
