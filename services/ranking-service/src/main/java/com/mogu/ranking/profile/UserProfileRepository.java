package com.mogu.ranking.profile;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class UserProfileRepository {
    private final JdbcTemplate jdbcTemplate;

    public UserProfileRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UserProfileFeatures> findProfile(UUID userId) {
        List<UserProfileFeatures> rows = jdbcTemplate.query(
            "SELECT interested_categories::text[] AS interested_categories, "
                + "wish_markets::text[] AS wish_markets, "
                + "wish_times "
                + "FROM app_user WHERE id = ?",
            new ProfileRowMapper(),
            userId
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static class ProfileRowMapper implements RowMapper<UserProfileFeatures> {
        @Override
        public UserProfileFeatures mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new UserProfileFeatures(
                toStringSet(rs.getArray("interested_categories")),
                toStringSet(rs.getArray("wish_markets")),
                toDoubleList(rs.getArray("wish_times"))
            );
        }

        private Set<String> toStringSet(Array array) throws SQLException {
            Set<String> values = new LinkedHashSet<>();
            if (array == null) {
                return values;
            }
            Object raw = array.getArray();
            if (raw instanceof Object[] items) {
                for (Object item : items) {
                    if (item != null) {
                        values.add(item.toString());
                    }
                }
            }
            return values;
        }

        private List<Double> toDoubleList(Array array) throws SQLException {
            List<Double> values = new ArrayList<>();
            if (array == null) {
                return values;
            }
            Object raw = array.getArray();
            if (raw instanceof Object[] items) {
                for (Object item : items) {
                    values.add(item instanceof Number number ? number.doubleValue() : 0.0);
                }
            }
            return values;
        }
    }
}
