package com.mogu.similarity.interaction;

import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class InteractionLoader {
    static final String AGGREGATED_SQL =
        "WITH raw AS ("
            + "SELECT user_id, mogu_post_id AS post_id, 2.0 AS w FROM participation "
            + "WHERE status::text IN ('accepted', 'fulfilled') "
            + "UNION ALL "
            + "SELECT user_id, mogu_post_id, 1.0 FROM mogu_favorite "
            + "UNION ALL "
            + "SELECT user_id, mogu_post_id, 0.5 FROM participation WHERE status::text = 'applied'"
            + "), agg AS ("
            + "SELECT user_id, post_id, SUM(w) AS w FROM raw GROUP BY user_id, post_id"
            + ") "
            + "SELECT user_id::text AS user_id, post_id::text AS post_id, w::float8 AS w FROM agg "
            + "ORDER BY user_id, post_id";

    private static final RowMapper<UserItemInteraction> ROW_MAPPER = (rs, rowNum) -> new UserItemInteraction(
        rs.getString("user_id"),
        rs.getString("post_id"),
        rs.getDouble("w")
    );

    private final JdbcTemplate jdbcTemplate;

    public InteractionLoader(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<UserItemInteraction> loadInteractions(int sampleLimit) {
        if (sampleLimit > 0) {
            return jdbcTemplate.query(AGGREGATED_SQL + " LIMIT ?", ROW_MAPPER, sampleLimit);
        }
        return jdbcTemplate.query(AGGREGATED_SQL, ROW_MAPPER);
    }
}
