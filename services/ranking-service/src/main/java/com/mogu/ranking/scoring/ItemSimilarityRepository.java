package com.mogu.ranking.scoring;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

@Repository
public class ItemSimilarityRepository {
    private final JdbcTemplate jdbcTemplate;

    public ItemSimilarityRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Map<String, Double> fetchSimilarity(Collection<String> candidateIds, Collection<String> historyIds) {
        Map<String, Double> scores = new HashMap<>();
        if (candidateIds.isEmpty() || historyIds.isEmpty()) {
            return scores;
        }
        List<Object> params = new ArrayList<>(candidateIds.size() + historyIds.size());
        params.addAll(candidateIds);
        params.addAll(historyIds);

        String sql = "SELECT s.src_post_id::text AS cid, MAX(s.sim) AS score "
            + "FROM item_item_sim s "
            + "WHERE s.src_post_id IN (" + placeholders(candidateIds.size()) + ") "
            + "AND s.neigh_post_id IN (" + placeholders(historyIds.size()) + ") "
            + "GROUP BY s.src_post_id";
        jdbcTemplate.query(
            sql,
            (RowCallbackHandler) rs -> {
                double score = rs.getDouble("score");
                scores.put(rs.getString("cid"), rs.wasNull() ? 0.0 : score);
            },
            params.toArray()
        );
        return scores;
    }

    private static String placeholders(int count) {
        StringBuilder builder = new StringBuilder(count * 9);
        for (int i = 0; i < count; i++) {
            if (i > 0) {
                builder.append(", ");
            }
            builder.append("?::uuid");
        }
        return builder.toString();
    }
}
