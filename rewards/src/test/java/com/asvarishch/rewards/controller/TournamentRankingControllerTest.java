package com.asvarishch.rewards.controller;

import com.asvarishch.rewards.dto.RankingEntryDTO;
import com.asvarishch.rewards.dto.RankingsResponse;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.service.TournamentRankingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TournamentRankingController.class)
@Import(ApiExceptionHandler.class)
class TournamentRankingControllerTest {

    @Autowired private MockMvc mockMvc;

    @MockBean private TournamentRankingService rankingService;

    @Test
    @DisplayName("Valid rankings are stored and echoed back")
    void submit() throws Exception {
        List<RankingEntryDTO> entries = List.of(new RankingEntryDTO(101L, 1, 95), new RankingEntryDTO(102L, 2, 80));
        when(rankingService.submitRankings(1L, entries)).thenReturn(new RankingsResponse(1L, 2, entries));

        mockMvc.perform(post("/api/tournaments/1/rankings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"rankings": [
                                  {"userId": 101, "rank": 1, "points": 95},
                                  {"userId": 102, "rank": 2, "points": 80}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.participants").value(2))
                .andExpect(jsonPath("$.rankings[0].userId").value(101));
    }

    @Test
    @DisplayName("Empty rankings -> 400 REWARD_BAD_REQUEST")
    void emptyRankings() throws Exception {
        mockMvc.perform(post("/api/tournaments/1/rankings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rankings\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("REWARD_BAD_REQUEST"));

        verifyNoInteractions(rankingService);
    }

    @Test
    @DisplayName("Non-positive rank inside the list -> 400 REWARD_BAD_REQUEST")
    void invalidEntry() throws Exception {
        mockMvc.perform(post("/api/tournaments/1/rankings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rankings\": [{\"userId\": 101, \"rank\": 0}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("REWARD_BAD_REQUEST"));
    }

    @Test
    @DisplayName("Malformed JSON -> 400 REWARD_BAD_REQUEST")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/tournaments/1/rankings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rankings\": [ }"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("REWARD_BAD_REQUEST"));
    }

    @Test
    @DisplayName("Frozen rankings -> 400 REWARD_VALIDATION_ERROR")
    void frozen() throws Exception {
        when(rankingService.submitRankings(eq(1L), anyList()))
                .thenThrow(new RewardValidationException("Rankings of tournament 1 are frozen once rewards are distributed"));

        mockMvc.perform(post("/api/tournaments/1/rankings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rankings\": [{\"userId\": 101, \"rank\": 1}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("REWARD_VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("GET returns the stored rankings")
    void getRankings() throws Exception {
        when(rankingService.getRankings(1L))
                .thenReturn(new RankingsResponse(1L, 1, List.of(new RankingEntryDTO(101L, 1, null))));

        mockMvc.perform(get("/api/tournaments/1/rankings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rankings[0].rank").value(1));
    }
}
