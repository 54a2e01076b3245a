package com.mogu.similarity.interaction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

@ExtendWith(MockitoExtension.class)
class InteractionLoaderTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Test
    void fullLoadHasNoLimit() {
        new InteractionLoader(jdbcTemplate).loadInteractions(0);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate).query(sql.capture(), any(RowMapper.class));
        assertThat(sql.getValue())
            .contains("SUM(w)")
            .contains("GROUP BY user_id, post_id")
            .endsWith("ORDER BY user_id, post_id");
    }

    @Test
    void sampleLimitIsBound() {
        new InteractionLoader(jdbcTemplate).loadInteractions(1000);

        verify(jdbcTemplate).query(eq(InteractionLoader.AGGREGATED_SQL + " LIMIT ?"), any(RowMapper.class), eq(1000));
    }
}
