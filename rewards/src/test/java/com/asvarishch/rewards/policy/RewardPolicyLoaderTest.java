package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.config.RewardProperties;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.util.JsonConfigHelper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for RewardPolicyLoader.
 * Verifies: template selection, blank config, fallback to the default policy on bad config.
 */
class RewardPolicyLoaderTest {

    private final RewardPolicyParser parser = new RewardPolicyParser(new JsonConfigHelper(new ObjectMapper()));

    private static Tournament tournament(String template, String config) {
        return Tournament.builder()
                .tournamentId(42L)
                .name("Loader Cup")
                .status(TournamentStatus.COMPLETED)
                .rewardTemplate(template)
                .rewardConfig(config)
                .build();
    }

    @Test
    @DisplayName("No config and no template -> STANDARD")
    void noConfig() {
        RewardPolicyLoader loader = new RewardPolicyLoader(parser, RewardProperties.defaults());

        RewardPolicy policy = loader.load(tournament(null, null));

        assertThat(policy).isEqualTo(RewardPolicyTemplates.standard());
        assertThat(policy.customConfig()).isFalse();
    }

    @Test
    @DisplayName("Blank config with a template -> that template")
    void templateOnly() {
        RewardPolicyLoader loader = new RewardPolicyLoader(parser, RewardProperties.defaults());

        RewardPolicy policy = loader.load(tournament("friendly", "  "));

        assertThat(policy).isEqualTo(RewardPolicyTemplates.friendly());
    }

    @Test
    @DisplayName("Config is layered over the tournament template")
    void configOverTemplate() {
        RewardPolicyLoader loader = new RewardPolicyLoader(parser, RewardProperties.defaults());

        RewardPolicy policy = loader.load(tournament("CHAMPIONSHIP", "{\"participation\": {\"credits\": 5}}"));

        assertThat(policy.customConfig()).isTrue();
        assertThat(policy.participation().credits()).isEqualTo(5);
        assertThat(policy.firstPlace()).isEqualTo(RewardPolicyTemplates.championship().firstPlace());
    }

    @Test
    @DisplayName("Malformed config falls back to the configured default template")
    void malformedConfig() {
        RewardPolicyLoader loader = new RewardPolicyLoader(parser, new RewardProperties(null, "FRIENDLY", 5));

        RewardPolicy policy = loader.load(tournament("CHAMPIONSHIP", "{\"first_place\": {\"credits\": -10}}"));

        assertThat(policy).isEqualTo(RewardPolicyTemplates.friendly());
    }

    @Test
    @DisplayName("Unknown default template name falls back to STANDARD")
    void unknownDefault() {
        RewardPolicyLoader loader = new RewardPolicyLoader(parser, new RewardProperties(null, "NOPE", 5));

        assertThat(loader.defaultPolicy()).isEqualTo(RewardPolicyTemplates.standard());
    }
}
