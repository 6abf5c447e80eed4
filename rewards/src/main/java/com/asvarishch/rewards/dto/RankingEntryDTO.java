package com.asvarishch.rewards.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record RankingEntryDTO(
        @NotNull @Positive Long userId,
        @NotNull @Positive Integer rank,
        @Min(0) Integer points
) {}
