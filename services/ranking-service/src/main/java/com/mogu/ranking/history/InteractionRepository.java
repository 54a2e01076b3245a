package com.mogu.ranking.history;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class InteractionRepository {
    private static final String HISTORY_SQL =
        "WITH u_hist AS ("
            + "(SELECT mogu_post_id AS pid, COALESCE(decided_at, applied_at) AS t "
            + "FROM participation "
            + "WHERE user_id = ? AND status::text IN ('accepted', 'fulfilled') "
            + "ORDER BY COALESCE(decided_at, applied_at) DESC "
            + "LIMIT ?) "
            + "UNION ALL "
            + "(SELECT mogu_post_id AS pid, created_at AS t "
            + "FROM mogu_favorite "
            + "WHERE user_id = ? "
            + "ORDER BY created_at DESC "
            + "LIMIT ?)"
            + ") "
            + "SELECT pid::text AS pid FROM u_hist ORDER BY t DESC NULLS LAST LIMIT ?";

    private static final String WEIGHTED_SQL =
        "WITH events AS ("
            + "SELECT mogu_post_id AS pid, 'STRONG' AS signal, COALESCE(decided_at, applied_at) AS t "
            + "FROM participation WHERE user_id = ? AND status::text IN ('accepted', 'fulfilled') "
            + "UNION ALL "
            + "SELECT mogu_post_id AS pid, 'MEDIUM' AS signal, applied_at AS t "
            + "FROM participation WHERE user_id = ? AND status::text = 'applied' "
            + "UNION ALL "
            + "SELECT mogu_post_id AS pid, 'WEAK' AS signal, created_at AS t "
            + "FROM mogu_favorite WHERE user_id = ?"
            + ") "
            + "SELECT pid::text AS pid, signal, t FROM events ORDER BY t DESC NULLS LAST LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    public InteractionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<String> fetchHistoryIds(UUID userId, int limit) {
        List<String> rows = jdbcTemplate.query(
            HISTORY_SQL,
            (rs, rowNum) -> rs.getString("pid"),
            userId,
            limit,
            userId,
            limit,
            limit
        );
        Set<String> distinct = new LinkedHashSet<>(rows);
        return new ArrayList<>(distinct);
    }

    public List<InteractionRecord> fetchWeightedInteractions(UUID userId, int limit) {
        String uid = userId.toString();
        return jdbcTemplate.query(
            WEIGHTED_SQL,
            (rs, rowNum) -> {
                Timestamp occurredAt = rs.getTimestamp("t");
                return InteractionRecord.of(
                    uid,
                    rs.getString("pid"),
                    SignalType.valueOf(rs.getString("signal")),
                    occurredAt == null ? null : occurredAt.toInstant()
                );
            },
            userId,
            userId,
            userId,
            limit
        );
    }
}
