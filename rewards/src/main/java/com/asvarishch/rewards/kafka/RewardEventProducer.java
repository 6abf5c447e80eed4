package com.asvarishch.rewards.kafka;

import com.asvarishch.rewards.dto.RewardsDistributedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RewardEventProducer {

    private final KafkaTemplate<String, RewardsDistributedEvent> kafkaTemplate;

    @Value("${topic.rewards-distributed}")
    private String topic;

    /** Keyed by tournamentId so events of one tournament stay ordered. */
    public void send(RewardsDistributedEvent event) {
        log.info("Publishing rewards-distributed event: tournamentId={}, outcome={}, count={}, xp={}, credits={}, badges={}",
                event.tournamentId(), event.outcome(), event.rewardsDistributedCount(),
                event.totalXpAwarded(), event.totalCreditsAwarded(), event.totalBadgesAwarded());
        kafkaTemplate.send(topic, String.valueOf(event.tournamentId()), event)
                .whenComplete((result, ex) -> {
                    if (ex != null) {
                        log.error("Failed to publish rewards-distributed event for tournamentId={}",
                                event.tournamentId(), ex);
                    }
                });
    }
}
