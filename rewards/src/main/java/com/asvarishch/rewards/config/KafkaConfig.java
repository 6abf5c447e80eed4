package com.asvarishch.rewards.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${topic.tournament-completed}")
    private String tournamentCompletedTopic;

    @Value("${topic.rewards-distributed}")
    private String rewardsDistributedTopic;

    @Bean
    public NewTopic tournamentCompletedTopic() {
        log.info("Creating Kafka topic '{}' with 3 partitions and RF=1", tournamentCompletedTopic);
        return new NewTopic(tournamentCompletedTopic, 3, (short) 1);
    }

    @Bean
    public NewTopic rewardsDistributedTopic() {
        log.info("Creating Kafka topic '{}' with 3 partitions and RF=1", rewardsDistributedTopic);
        return new NewTopic(rewardsDistributedTopic, 3, (short) 1);
    }
}
