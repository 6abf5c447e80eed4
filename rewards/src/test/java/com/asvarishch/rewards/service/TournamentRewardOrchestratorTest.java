package com.asvarishch.rewards.service;

import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.RewardsDistributedEvent;
import com.asvarishch.rewards.enums.DistributionOutcome;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.kafka.RewardEventProducer;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentParticipation;
import com.asvarishch.rewards.model.TournamentRanking;
import com.asvarishch.rewards.repository.TournamentParticipationRepository;
import com.asvarishch.rewards.repository.TournamentRankingRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TournamentRewardOrchestratorTest {

    @Mock private RewardDistributionService distributionService;
    @Mock private RewardQueryService queryService;
    @Mock private RewardEventProducer eventProducer;
    @Mock private TournamentRepository tournamentRepository;
    @Mock private TournamentRankingRepository rankingRepository;
    @Mock private TournamentParticipationRepository participationRepository;

    private TournamentRewardOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new TournamentRewardOrchestrator(distributionService, queryService, eventProducer,
                tournamentRepository, rankingRepository, participationRepository);
    }

    private static DistributionSummary summary(DistributionOutcome outcome, int count) {
        return DistributionSummary.builder()
                .tournamentId(1L)
                .outcome(outcome)
                .rewardsDistributedCount(count)
                .totalXpAwarded(count * 100L)
                .totalCreditsAwarded(count * 50L)
                .totalBadgesAwarded(count)
                .distributedAt(Instant.parse("2026-03-01T12:00:00Z"))
                .build();
    }

    private static Tournament tournament(TournamentStatus status) {
        return Tournament.builder().tournamentId(1L).name("Spring Cup").status(status).build();
    }

    private static TournamentRanking ranking(Tournament t, long userId, int placement) {
        return TournamentRanking.builder().rankingId(userId * 10).tournament(t).userId(userId).placement(placement).build();
    }

    private static TournamentParticipation participation(Tournament t, long userId) {
        return TournamentParticipation.builder().participationId(userId).tournament(t).userId(userId).build();
    }

    @Test
    @DisplayName("Written rewards are returned and announced on Kafka")
    void publishesEvent() {
        DistributionSummary distributed = summary(DistributionOutcome.DISTRIBUTED, 8);
        when(distributionService.distribute(1L, false, "ops")).thenReturn(distributed);

        DistributionSummary result = orchestrator.distributeRewards(1L, false, "ops");

        assertThat(result).isSameAs(distributed);
        ArgumentCaptor<RewardsDistributedEvent> event = ArgumentCaptor.forClass(RewardsDistributedEvent.class);
        verify(eventProducer).send(event.capture());
        assertThat(event.getValue().tournamentId()).isEqualTo(1L);
        assertThat(event.getValue().rewardsDistributedCount()).isEqualTo(8);
        assertThat(event.getValue().totalXpAwarded()).isEqualTo(800L);
        assertThat(event.getValue().outcome()).isEqualTo(DistributionOutcome.DISTRIBUTED);
    }

    @Test
    @DisplayName("Nothing written -> no event")
    void noEventForNoOp() {
        when(distributionService.distribute(1L, false, null)).thenReturn(summary(DistributionOutcome.ALREADY_DISTRIBUTED, 0));

        DistributionSummary result = orchestrator.distributeRewards(1L, false, null);

        assertThat(result.rewardsDistributedCount()).isZero();
        verifyNoInteractions(eventProducer);
    }

    @Test
    @DisplayName("Unique-constraint race lost to a completed distribution -> persisted rewards, no event")
    void concurrentDistribution() {
        Tournament t = tournament(TournamentStatus.REWARDS_DISTRIBUTED);
        DistributionSummary persisted = summary(DistributionOutcome.ALREADY_DISTRIBUTED, 0);
        when(distributionService.distribute(1L, false, null))
                .thenThrow(new DataIntegrityViolationException("uk_participation_user_tournament"));
        when(tournamentRepository.findById(1L)).thenReturn(Optional.of(t));
        when(participationRepository.findByTournament_TournamentId(1L))
                .thenReturn(List.of(participation(t, 101L), participation(t, 102L)));
        when(rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(1L))
                .thenReturn(List.of(ranking(t, 101L, 1), ranking(t, 102L, 2)));
        when(queryService.getPersistedSummary(1L, "Rewards were distributed by a concurrent request."))
                .thenReturn(persisted);

        DistributionSummary result = orchestrator.distributeRewards(1L, false, null);

        assertThat(result).isSameAs(persisted);
        verify(eventProducer, never()).send(any());
    }

    @Test
    @DisplayName("Integrity failure while the tournament is still COMPLETED is rethrown")
    void storageFailurePropagates() {
        DataIntegrityViolationException failure = new DataIntegrityViolationException("value too long for column TITLE");
        when(distributionService.distribute(1L, false, null)).thenThrow(failure);
        when(tournamentRepository.findById(1L)).thenReturn(Optional.of(tournament(TournamentStatus.COMPLETED)));

        assertThatThrownBy(() -> orchestrator.distributeRewards(1L, false, null)).isSameAs(failure);
        verifyNoInteractions(queryService, eventProducer);
    }

    @Test
    @DisplayName("Integrity failure with ranked users left unrewarded is rethrown")
    void partiallyRewardedTournamentPropagates() {
        Tournament t = tournament(TournamentStatus.REWARDS_DISTRIBUTED);
        when(distributionService.distribute(1L, false, null))
                .thenThrow(new DataIntegrityViolationException("ck_skill_rewards"));
        when(tournamentRepository.findById(1L)).thenReturn(Optional.of(t));
        when(participationRepository.findByTournament_TournamentId(1L)).thenReturn(List.of(participation(t, 101L)));
        when(rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(1L))
                .thenReturn(List.of(ranking(t, 101L, 1), ranking(t, 102L, 2)));

        assertThatThrownBy(() -> orchestrator.distributeRewards(1L, false, null))
                .isInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(queryService);
    }

    @Test
    @DisplayName("Integrity failure on a forced run is rethrown without inspecting stored state")
    void forcedRunFailurePropagates() {
        when(distributionService.distribute(1L, true, "admin"))
                .thenThrow(new DataIntegrityViolationException("uk_badge_user_tournament_type"));

        assertThatThrownBy(() -> orchestrator.distributeRewards(1L, true, "admin"))
                .isInstanceOf(DataIntegrityViolationException.class);
        verifyNoInteractions(tournamentRepository, queryService, eventProducer);
    }

    @Test
    @DisplayName("Validation errors are not swallowed")
    void validationPropagates() {
        when(distributionService.distribute(1L, true, null))
                .thenThrow(new RewardValidationException("Tournament 1 must be COMPLETED"));

        assertThatThrownBy(() -> orchestrator.distributeRewards(1L, true, null))
                .isInstanceOf(RewardValidationException.class);
        verifyNoInteractions(queryService, eventProducer);
    }
}
