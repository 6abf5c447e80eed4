package com.asvarishch.rewards.dto;

import java.util.List;

/**
 * Published by the bracket service once final placements are known.
 * {@code rankings} may be left empty when they were already submitted over REST.
 */
public record TournamentCompletedEvent(
        Long tournamentId,
        List<RankingEntryDTO> rankings,
        String distributedBy,
        boolean forceRedistribution
) {}
