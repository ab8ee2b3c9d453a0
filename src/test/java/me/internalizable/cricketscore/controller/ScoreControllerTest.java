package me.internalizable.cricketscore.controller;

import me.internalizable.cricketscore.cache.ScoreboardCache;
import me.internalizable.cricketscore.config.JacksonConfig;
import me.internalizable.cricketscore.dto.HitRequest;
import me.internalizable.cricketscore.exception.InvalidSubmissionException;
import me.internalizable.cricketscore.exception.RateLimitExceededException;
import me.internalizable.cricketscore.exception.StoreException;
import me.internalizable.cricketscore.model.Participant;
import me.internalizable.cricketscore.service.ScoreIngestService;
import me.internalizable.cricketscore.service.ScoreboardQueryService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ScoreController.class)
@Import(JacksonConfig.class)
class ScoreControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ScoreIngestService scoreIngestService;

    @MockBean
    private ScoreboardQueryService scoreboardQueryService;

    @MockBean
    private ScoreboardCache scoreboardCache;

    @Test
    void testHit_success() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"shot\":6}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Shot recorded successfully"))
                .andExpect(jsonPath("$.error").doesNotExist())
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));

        verify(scoreIngestService).hit(new HitRequest("1234567890", "Virat", 6));
    }

    @Test
    void testHit_missingFieldsBoundAsZeroValues() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"extra\":true}"))
                .andExpect(status().isOk());

        verify(scoreIngestService).hit(new HitRequest("1234567890", "Virat", 0));
    }

    @Test
    void testHit_invalidRollNumber() throws Exception {
        doThrow(new InvalidSubmissionException("Roll number must be exactly 10 digits"))
                .when(scoreIngestService).hit(any());

        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"12\",\"name\":\"Virat\",\"shot\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Roll number must be exactly 10 digits"));
    }

    @Test
    void testHit_missingName() throws Exception {
        doThrow(new InvalidSubmissionException("Name is required"))
                .when(scoreIngestService).hit(any());

        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"shot\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Name is required"));
    }

    @Test
    void testHit_rateLimited() throws Exception {
        doThrow(new RateLimitExceededException("1234567890", "Too many requests. Please wait a few seconds."))
                .when(scoreIngestService).hit(any());

        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"shot\":6}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too many requests. Please wait a few seconds."));
    }

    @Test
    void testHit_malformedJson_rejectedBeforeService() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\": \"1234567890\", "))
                .andExpect(status().isBadRequest())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN))
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_fractionalShot_rejected() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"shot\":4.5}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_numericRollNumber_rejected() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":1234567890,\"name\":\"Virat\",\"shot\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_numericName_rejected() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":42,\"shot\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_booleanName_rejected() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":true,\"shot\":6}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_stringShot_rejected() throws Exception {
        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"shot\":\"6\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_jsonNullBody_validatedAsEmptySubmission() throws Exception {
        doThrow(new InvalidSubmissionException("Roll number must be exactly 10 digits"))
                .when(scoreIngestService).hit(HitRequest.EMPTY);

        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("null"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Roll number must be exactly 10 digits"));

        verify(scoreIngestService).hit(HitRequest.EMPTY);
    }

    @Test
    void testHit_emptyBody_rejected() throws Exception {
        mockMvc.perform(post("/hit").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid input"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testHit_storeFailure_terseMessage() throws Exception {
        doThrow(new StoreException("Error updating score", new DataAccessResourceFailureException("socket timeout on db-1")))
                .when(scoreIngestService).hit(any());

        mockMvc.perform(post("/hit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"rollNumber\":\"1234567890\",\"name\":\"Virat\",\"shot\":6}"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string("Error updating score"));
    }

    @Test
    void testScoreboard_returnsRankedParticipants() throws Exception {
        when(scoreboardQueryService.getScoreboard()).thenReturn(List.of(
                new Participant("65f0c0ffee", "1000000002", "B", 25, Instant.parse("2024-01-01T00:00:05Z")),
                Participant.of("1000000001", "A", 10, Instant.parse("2024-01-01T00:00:00Z"))));

        mockMvc.perform(get("/scoreboard"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].rollNumber").value("1000000002"))
                .andExpect(jsonPath("$[0].name").value("B"))
                .andExpect(jsonPath("$[0].score").value(25))
                .andExpect(jsonPath("$[0].lastPlayed").value(startsWith("2024-01-01T00:00:05")))
                .andExpect(jsonPath("$[0].id").doesNotExist())
                .andExpect(jsonPath("$[1].name").value("A"));
    }

    @Test
    void testScoreboard_emptyArray() throws Exception {
        when(scoreboardQueryService.getScoreboard()).thenReturn(List.of());

        mockMvc.perform(get("/scoreboard"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    void testScoreboard_storeFailure() throws Exception {
        when(scoreboardQueryService.getScoreboard())
                .thenThrow(new StoreException("Error fetching scoreboard", new DataAccessResourceFailureException("down")));

        mockMvc.perform(get("/scoreboard"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string("Error fetching scoreboard"));
    }

    @Test
    void testPreflight_shortCircuits() throws Exception {
        mockMvc.perform(options("/hit")
                        .header("Origin", "http://example.com")
                        .header("Access-Control-Request-Method", "POST"))
                .andExpect(status().isOk())
                .andExpect(content().string(""))
                .andExpect(header().string("Access-Control-Allow-Origin", "*"))
                .andExpect(header().string("Access-Control-Allow-Methods", "GET, POST, PUT, DELETE, OPTIONS"))
                .andExpect(header().string("Access-Control-Allow-Headers", "*"));

        verifyNoInteractions(scoreIngestService);
    }

    @Test
    void testCacheStats() throws Exception {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("name", "scoreboard");
        stats.put("hits", 3L);
        when(scoreboardCache.getStats()).thenReturn(stats);

        mockMvc.perform(get("/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("scoreboard"))
                .andExpect(jsonPath("$.hits").value(3));
    }

    @Test
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"))
                .andExpect(header().string("Access-Control-Allow-Origin", "*"));
    }
}
