package com.mogu.ranking.candidate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class CandidateRepository {
    static final double DEFAULT_REPUTATION = 0.5;

    private static final String USER_POINT = "ST_SetSRID(ST_MakePoint(?, ?), 4326)::geography";
    private static final String SELECT_FIELDS =
        "SELECT p.id::text AS id, "
            + "p.user_id::text AS host_id, "
            + "p.category::text AS category, "
            + "p.mogu_market::text AS mogu_market, "
            + "p.mogu_datetime, "
            + "p.created_at, "
            + "ST_Distance(p.mogu_spot::geography, " + USER_POINT + ") / 1000.0 AS dist_km, "
            + "EXTRACT(hour FROM p.mogu_datetime)::int AS hour, "
            + "COALESCE(((COALESCE(mv.avg_stars, 3.0) - 1.0) / 4.0), 0.5)::float AS rep "
            + "FROM mogu_post p "
            + "LEFT JOIN mv_host_reputation mv ON mv.reviewee_id = p.user_id ";
    private static final String BASE_WHERE =
        "WHERE p.status = 'recruiting' "
            + "AND p.mogu_datetime > now() "
            + "AND ST_DWithin(p.mogu_spot::geography, " + USER_POINT + ", ?)";

    private final JdbcTemplate jdbcTemplate;

    public CandidateRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<CandidateListing> fetchCandidates(CandidateQuery query, int limit) {
        StringBuilder sql = new StringBuilder(SELECT_FIELDS).append(BASE_WHERE);

        List<Object> params = new ArrayList<>();
        params.add(query.longitude());
        params.add(query.latitude());
        params.add(query.longitude());
        params.add(query.latitude());
        params.add(query.radiusKm() * 1000.0);

        if (query.category() != null) {
            sql.append(" AND p.category::text = ?");
            params.add(query.category());
        }
        if (query.market() != null) {
            sql.append(" AND p.mogu_market::text = ?");
            params.add(query.market());
        }

        sql.append(" ORDER BY p.created_at DESC LIMIT ?");
        params.add(limit);
        return jdbcTemplate.query(sql.toString(), new CandidateRowMapper(), params.toArray());
    }

    static double clampReputation(Double raw) {
        if (raw == null || raw.isNaN()) {
            return DEFAULT_REPUTATION;
        }
        return Math.max(0.0, Math.min(1.0, raw));
    }

    private static class CandidateRowMapper implements RowMapper<CandidateListing> {
        @Override
        public CandidateListing mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp scheduledAt = rs.getTimestamp("mogu_datetime");
            Timestamp createdAt = rs.getTimestamp("created_at");
            int hour = rs.getInt("hour");
            boolean hourMissing = rs.wasNull();
            double rep = rs.getDouble("rep");
            boolean repMissing = rs.wasNull();
            return new CandidateListing(
                rs.getString("id"),
                rs.getString("host_id"),
                rs.getString("category"),
                rs.getString("mogu_market"),
                scheduledAt == null ? null : scheduledAt.toInstant(),
                hourMissing ? null : hour,
                rs.getDouble("dist_km"),
                createdAt == null ? Instant.EPOCH : createdAt.toInstant(),
                clampReputation(repMissing ? null : rep)
            );
        }
    }
}
