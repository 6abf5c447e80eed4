package com.asvarishch.rewards.controller;

import com.asvarishch.rewards.dto.BadgeShowcaseResponse;
import com.asvarishch.rewards.dto.SkillProfileResponse;
import com.asvarishch.rewards.enums.SkillTier;
import com.asvarishch.rewards.service.RewardQueryService;
import com.asvarishch.rewards.service.SkillProfileService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(UserProgressController.class)
@Import(ApiExceptionHandler.class)
class UserProgressControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private RewardQueryService queryService;
    @MockBean private SkillProfileService skillProfileService;

    @Test
    @DisplayName("GET skills returns levels with their tier")
    void skills() throws Exception {
        SkillProfileResponse.SkillLevel speed = SkillProfileResponse.SkillLevel.builder()
                .baseline(new BigDecimal("70.0"))
                .currentLevel(new BigDecimal("85.0"))
                .tournamentDelta(new BigDecimal("15.0"))
                .ledgerPoints(new BigDecimal("4.4"))
                .tournamentCount(1)
                .tier(SkillTier.ADVANCED)
                .build();
        when(skillProfileService.getSkillProfile(101L)).thenReturn(SkillProfileResponse.builder()
                .userId(101L)
                .skills(Map.of("speed", speed))
                .averageLevel(new BigDecimal("85.0"))
                .totalTournaments(1)
                .build());

        mockMvc.perform(get("/api/users/101/skills"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skills.speed.tier").value("ADVANCED"))
                .andExpect(jsonPath("$.skills.speed.currentLevel").value(85.0))
                .andExpect(jsonPath("$.totalTournaments").value(1));
    }

    @Test
    @DisplayName("GET badge showcase for a user without badges returns empty sections")
    void emptyShowcase() throws Exception {
        when(queryService.getBadgeShowcase(9L)).thenReturn(BadgeShowcaseResponse.builder()
                .userId(9L)
                .totalBadges(0)
                .rarestBadges(List.of())
                .recentBadges(List.of())
                .byCategory(Map.of())
                .build());

        mockMvc.perform(get("/api/users/9/badges/showcase"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalBadges").value(0))
                .andExpect(jsonPath("$.rarestBadges").isEmpty());
    }
}
