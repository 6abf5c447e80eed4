package com.asvarishch.rewards.dto;

import com.asvarishch.rewards.enums.BadgeCategory;
import lombok.Builder;

import java.util.List;
import java.util.Map;

@Builder
public record BadgeShowcaseResponse(
        Long userId,
        int totalBadges,
        List<BadgeDTO> rarestBadges,
        List<BadgeDTO> recentBadges,
        Map<BadgeCategory, CategorySection> byCategory
) {

    public record CategorySection(int count, List<BadgeDTO> topBadges) {}
}
