package com.asvarishch.rewards.dto;

import java.util.List;

public record RankingsResponse(
        Long tournamentId,
        int participants,
        List<RankingEntryDTO> rankings
) {}
