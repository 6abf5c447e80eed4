package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.SkillCategory;
import lombok.Builder;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable reward policy of one tournament, loaded once per call and passed down by value.
 * <p>
 * Placement 1, 2 and 3 have their own tier; every other placement falls back to {@link #participation()}.
 */
@Builder(toBuilder = true)
public record RewardPolicy(
        String templateName,
        boolean customConfig,
        List<SkillMapping> skillMappings,
        PlacementTier firstPlace,
        PlacementTier secondPlace,
        PlacementTier thirdPlace,
        PlacementTier participation
) {

    public RewardPolicy {
        skillMappings = skillMappings == null ? List.of() : List.copyOf(skillMappings);
        Objects.requireNonNull(firstPlace, "firstPlace tier must not be null");
        Objects.requireNonNull(secondPlace, "secondPlace tier must not be null");
        Objects.requireNonNull(thirdPlace, "thirdPlace tier must not be null");
        Objects.requireNonNull(participation, "participation tier must not be null");
    }

    /** Exact-rank tier for 1..3, the participation tier otherwise. */
    public PlacementTier tierFor(int placement) {
        return switch (placement) {
            case 1 -> firstPlace;
            case 2 -> secondPlace;
            case 3 -> thirdPlace;
            default -> participation;
        };
    }

    public boolean hasPlacementTier(int placement) {
        return placement >= 1 && placement <= 3;
    }

    public List<SkillMapping> enabledSkillMappings() {
        return skillMappings.stream().filter(SkillMapping::enabled).toList();
    }

    public Optional<SkillCategory> categoryOf(String skillName) {
        return skillMappings.stream()
                .filter(m -> m.skillName().equals(skillName))
                .map(SkillMapping::category)
                .findFirst();
    }
}
