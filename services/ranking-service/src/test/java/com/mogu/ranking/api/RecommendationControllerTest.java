package com.mogu.ranking.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mogu.ranking.candidate.CandidateFixtures;
import com.mogu.ranking.ranking.EnsembleWeights;
import com.mogu.ranking.ranking.RankedPage;
import com.mogu.ranking.ranking.ScoredListing;
import com.mogu.ranking.ranking.SortMode;
import com.mogu.ranking.service.RecommendationRequest;
import com.mogu.ranking.service.RecommendationResult;
import com.mogu.ranking.service.RecommendationService;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(RecommendationController.class)
class RecommendationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecommendationService recommendationService;

    @Test
    void healthReturnsOk() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ok"));
    }

    @Test
    void recommendedReturnsOrderedIds() throws Exception {
        when(recommendationService.recommend(any(RecommendationRequest.class))).thenReturn(sampleResult());

        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5")
                .param("longitude", "127.0")
                .header("x-request-id", "req-1"))
            .andExpect(status().isOk())
            .andExpect(header().string("x-request-id", "req-1"))
            .andExpect(jsonPath("$.request_id").value("req-1"))
            .andExpect(jsonPath("$.post_ids.length()").value(2))
            .andExpect(jsonPath("$.post_ids[0]").value("p2"))
            .andExpect(jsonPath("$.post_ids[1]").value("p1"))
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.sort").value("ai_recommended"))
            .andExpect(jsonPath("$.hits").doesNotExist())
            .andExpect(jsonPath("$.debug").doesNotExist());
    }

    @Test
    void debugIncludesScoreBreakdown() throws Exception {
        when(recommendationService.recommend(any(RecommendationRequest.class))).thenReturn(sampleResult());

        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5")
                .param("longitude", "127.0")
                .param("debug", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.hits[0].post_id").value("p2"))
            .andExpect(jsonPath("$.hits[0].rank").value(1))
            .andExpect(jsonPath("$.hits[0].final").value(0.9))
            .andExpect(jsonPath("$.hits[1].v1").value(0.0))
            .andExpect(jsonPath("$.debug.w1").value(0.2))
            .andExpect(jsonPath("$.debug.history_strength").value(0.3))
            .andExpect(jsonPath("$.debug.reason_codes[0]").value("history_empty"));
    }

    @Test
    void parametersAreForwardedToService() throws Exception {
        when(recommendationService.recommend(any(RecommendationRequest.class))).thenReturn(sampleResult());
        UUID userId = UUID.randomUUID();

        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5")
                .param("longitude", "127.0")
                .param("radius", "2.5")
                .param("category", "food")
                .param("mogu_market", "costco")
                .param("sort", "recent")
                .param("page", "2")
                .param("size", "10")
                .header("x-user-id", userId.toString()))
            .andExpect(status().isOk());

        ArgumentCaptor<RecommendationRequest> captor = ArgumentCaptor.forClass(RecommendationRequest.class);
        verify(recommendationService).recommend(captor.capture());
        RecommendationRequest request = captor.getValue();
        assertThat(request.radiusKm()).isEqualTo(2.5);
        assertThat(request.category()).isEqualTo("food");
        assertThat(request.market()).isEqualTo("costco");
        assertThat(request.sort()).isEqualTo(SortMode.RECENT);
        assertThat(request.page()).isEqualTo(2);
        assertThat(request.size()).isEqualTo(10);
        assertThat(request.userId()).isEqualTo(userId);
    }

    @Test
    void missingLatitudeIsBadRequest() throws Exception {
        mockMvc.perform(get("/v1/posts/recommended").param("longitude", "127.0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
        verifyNoInteractions(recommendationService);
    }

    @Test
    void invalidParametersAreRejected() throws Exception {
        mockMvc.perform(get("/v1/posts/recommended").param("latitude", "91").param("longitude", "127.0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5").param("longitude", "127.0").param("sort", "popular"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5").param("longitude", "127.0").param("page", "0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5").param("longitude", "127.0").header("x-user-id", "not-a-uuid"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("x-user-id must be a UUID"));
        mockMvc.perform(get("/v1/posts/recommended").param("latitude", "abc").param("longitude", "127.0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
        verifyNoInteractions(recommendationService);
    }

    @Test
    void nonFiniteCoordinatesAndRadiusAreRejected() throws Exception {
        mockMvc.perform(get("/v1/posts/recommended").param("latitude", "NaN").param("longitude", "127.0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.code").value("bad_request"));
        mockMvc.perform(get("/v1/posts/recommended").param("latitude", "37.5").param("longitude", "NaN"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/posts/recommended").param("latitude", "Infinity").param("longitude", "127.0"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5").param("longitude", "127.0").param("radius", "NaN"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error.message").value("radius must be a positive number"));
        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5").param("longitude", "127.0").param("radius", "Infinity"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(recommendationService);
    }

    private static RecommendationResult sampleResult() {
        ScoredListing first = new ScoredListing(CandidateFixtures.listing("p2", "food", "costco", 18), 1.0, 0.5, 0.9);
        ScoredListing second = new ScoredListing(CandidateFixtures.listing("p1", "food", "emart", 9), 0.25, 0.0, 0.2);
        return new RecommendationResult(
            new RankedPage(List.of(first, second), 2, 1, 20),
            SortMode.AI_RECOMMENDED,
            new EnsembleWeights(0.8, 0.2, 0.2, 1.0),
            0.3,
            0.5,
            2,
            List.of("history_empty")
        );
    }
}
