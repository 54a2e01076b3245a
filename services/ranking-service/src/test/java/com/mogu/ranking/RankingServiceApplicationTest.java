package com.mogu.ranking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mogu.ranking.api.RequestLoggingFilter;
import com.mogu.ranking.candidate.CandidateFixtures;
import com.mogu.ranking.candidate.CandidateQuery;
import com.mogu.ranking.candidate.CandidateRepository;
import com.mogu.ranking.history.InteractionRepository;
import com.mogu.ranking.profile.UserProfileRepository;
import com.mogu.ranking.scoring.ItemSimilarityRepository;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.ApplicationContext;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.filter.RequestContextFilter;

@SpringBootTest
@AutoConfigureMockMvc
class RankingServiceApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CandidateRepository candidateRepository;

    @MockBean
    private UserProfileRepository profileRepository;

    @MockBean
    private InteractionRepository interactionRepository;

    @MockBean
    private ItemSimilarityRepository similarityRepository;

    @Test
    void contextRegistersRequestLoggingNextToSpringRequestContext() {
        assertThat(context.getBeansOfType(RequestLoggingFilter.class)).hasSize(1);
        assertThat(context.getBeansOfType(RequestContextFilter.class)).isNotEmpty();
    }

    @Test
    void recommendedEndpointServesThroughFullContext() throws Exception {
        when(candidateRepository.fetchCandidates(any(CandidateQuery.class), anyInt())).thenReturn(List.of(
            CandidateFixtures.listing("p1", "food", "costco", 10),
            CandidateFixtures.listing("p2", "household", "emart", 12)
        ));

        mockMvc.perform(get("/v1/posts/recommended")
                .param("latitude", "37.5")
                .param("longitude", "127.0")
                .header("x-request-id", "req-ctx"))
            .andExpect(status().isOk())
            .andExpect(header().string("x-request-id", "req-ctx"))
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.post_ids.length()").value(2));
    }
}
