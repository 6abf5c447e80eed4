package com.asvarishch.rewards.dto;

import jakarta.validation.constraints.Size;

public record DistributeRewardsRequest(
        boolean forceRedistribution,
        @Size(max = 120) String distributedBy
) {}
