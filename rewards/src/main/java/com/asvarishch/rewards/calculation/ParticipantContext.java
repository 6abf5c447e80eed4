package com.asvarishch.rewards.calculation;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Everything the calculation needs to know about one participant, gathered before computing.
 *
 * @param priorTournamentCount   tournaments the user was rewarded for, this one excluded
 * @param priorSkillTournaments  per skill, tournaments whose rewards touched it, this one excluded
 * @param presentBadgeTypes      badge types the user already holds for this tournament
 * @param heldMilestoneTypes     milestone badge types the user holds in any tournament
 */
@Builder
public record ParticipantContext(
        Long userId,
        Long tournamentId,
        String tournamentName,
        int placement,
        int totalParticipants,
        Integer score,
        int priorTournamentCount,
        Map<String, BigDecimal> skillBaselines,
        Map<String, Integer> priorSkillTournaments,
        Set<String> presentBadgeTypes,
        Set<String> heldMilestoneTypes
) {

    public ParticipantContext {
        skillBaselines = skillBaselines == null ? Map.of() : Map.copyOf(skillBaselines);
        priorSkillTournaments = priorSkillTournaments == null ? Map.of() : Map.copyOf(priorSkillTournaments);
        presentBadgeTypes = presentBadgeTypes == null ? Set.of() : Set.copyOf(presentBadgeTypes);
        heldMilestoneTypes = heldMilestoneTypes == null ? Set.of() : Set.copyOf(heldMilestoneTypes);
    }

    public boolean isFirstTournament() {
        return priorTournamentCount == 0;
    }

    /** Tournaments completed once this one is counted. */
    public int tournamentsCompleted() {
        return priorTournamentCount + 1;
    }
}
