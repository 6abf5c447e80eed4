package com.asvarishch.rewards.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record SubmitRankingsRequest(
        @NotEmpty List<@Valid RankingEntryDTO> rankings
) {}
