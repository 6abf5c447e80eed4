package com.asvarishch.rewards.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(RewardProperties.class)
public class RewardsConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
