package com.asvarishch.rewards.config;

import com.asvarishch.rewards.enums.SkillCategory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;

class RewardPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner =
            new ApplicationContextRunner().withUserConfiguration(RewardsConfig.class);

    @Test
    void defaultsApplyWhenNothingIsConfigured() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(Clock.class);
            final RewardProperties properties = context.getBean(RewardProperties.class);

            assertThat(properties.defaultTemplate()).isEqualTo("STANDARD");
            assertThat(properties.showcaseLimit()).isEqualTo(5);
            assertThat(properties.xpRate(SkillCategory.PHYSICAL)).isEqualTo(8);
            assertThat(properties.xpRate(SkillCategory.TECHNICAL)).isEqualTo(10);
            assertThat(properties.xpRate(SkillCategory.TACTICAL)).isEqualTo(10);
            assertThat(properties.xpRate(SkillCategory.MENTAL)).isEqualTo(12);
        });
    }

    @Test
    void overridesMergeWithDefaultRates() {
        contextRunner
                .withPropertyValues(
                        "rewards.default-template=CHAMPIONSHIP",
                        "rewards.showcase-limit=3",
                        "rewards.xp-per-skill-point.MENTAL=15")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    final RewardProperties properties = context.getBean(RewardProperties.class);

                    assertThat(properties.defaultTemplate()).isEqualTo("CHAMPIONSHIP");
                    assertThat(properties.showcaseLimit()).isEqualTo(3);
                    assertThat(properties.xpRate(SkillCategory.MENTAL)).isEqualTo(15);
                    assertThat(properties.xpRate(SkillCategory.PHYSICAL)).isEqualTo(8);
                });
    }

    @Test
    void nonPositiveShowcaseLimitFallsBackToDefault() {
        contextRunner
                .withPropertyValues("rewards.showcase-limit=0", "rewards.default-template= ")
                .run(context -> {
                    final RewardProperties properties = context.getBean(RewardProperties.class);

                    assertThat(properties.showcaseLimit()).isEqualTo(5);
                    assertThat(properties.defaultTemplate()).isEqualTo("STANDARD");
                });
    }
}
