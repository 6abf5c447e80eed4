package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.config.RewardProperties;
import com.asvarishch.rewards.exception.RewardPolicyException;
import com.asvarishch.rewards.model.Tournament;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Resolves the effective policy of a tournament. Never fails: a missing or malformed config
 * is logged and replaced by the default policy.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RewardPolicyLoader {

    private final RewardPolicyParser parser;
    private final RewardProperties properties;

    public RewardPolicy load(Tournament tournament) {
        final RewardPolicy base = RewardPolicyTemplates.byName(tournament.getRewardTemplate())
                .orElseGet(this::defaultPolicy);

        if (tournament.getRewardConfig() == null || tournament.getRewardConfig().isBlank()) {
            log.info("[POLICY] No reward config for tournamentId={}, using template {}",
                    tournament.getTournamentId(), base.templateName());
            return base;
        }

        try {
            return parser.parse(tournament.getRewardConfig(), base);
        } catch (RewardPolicyException e) {
            final RewardPolicy fallback = defaultPolicy();
            log.warn("[POLICY] Invalid reward config for tournamentId={}: {}. Falling back to {} policy",
                    tournament.getTournamentId(), e.getMessage(), fallback.templateName());
            return fallback;
        }
    }

    public RewardPolicy defaultPolicy() {
        return RewardPolicyTemplates.byName(properties.defaultTemplate())
                .orElseGet(RewardPolicyTemplates::standard);
    }
}
