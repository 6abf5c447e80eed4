package com.asvarishch.rewards.kafka;

import com.asvarishch.rewards.dto.DistributionSummary;
import com.asvarishch.rewards.dto.TournamentCompletedEvent;
import com.asvarishch.rewards.service.TournamentRankingService;
import com.asvarishch.rewards.service.TournamentRewardOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;


/**
 * Stores the final rankings carried by a {@code tournament-completed} event and distributes rewards.
 * Redelivery is harmless: identical rankings are accepted after distribution and the distribution itself is idempotent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TournamentCompletedConsumer {

    private final TournamentRankingService rankingService;
    private final TournamentRewardOrchestrator orchestrator;

    @KafkaListener(topics = "${topic.tournament-completed}")
    public void onTournamentCompleted(ConsumerRecord<String, TournamentCompletedEvent> record) {
        final TournamentCompletedEvent event = record.value();
        log.info("Tournament completed event received: key='{}', value='{}'", record.key(), event);

        if (event.rankings() != null && !event.rankings().isEmpty()) {
            rankingService.submitRankings(event.tournamentId(), event.rankings());
        }
        final DistributionSummary summary = orchestrator.distributeRewards(
                event.tournamentId(), event.forceRedistribution(), event.distributedBy());
        log.info("Tournament completed event handled: tournamentId={}, outcome={}, count={}",
                event.tournamentId(), summary.outcome(), summary.rewardsDistributedCount());
    }
}
