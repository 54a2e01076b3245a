package com.mogu.similarity.store;

import com.mogu.similarity.build.SimilarityRow;
import com.mogu.similarity.config.SimilarityBatchProperties;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public class ItemSimilarityWriter {
    private static final Logger logger = LoggerFactory.getLogger(ItemSimilarityWriter.class);

    static final String DELETE_SQL = "DELETE FROM item_item_sim";
    static final String INSERT_SQL =
        "INSERT INTO item_item_sim (src_post_id, neigh_post_id, sim, common_user_count, updated_at) "
            + "VALUES (?::uuid, ?::uuid, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final SimilarityBatchProperties properties;
    private final Clock clock;

    public ItemSimilarityWriter(JdbcTemplate jdbcTemplate, SimilarityBatchProperties properties, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public int replaceAll(List<SimilarityRow> rows) {
        int deleted = jdbcTemplate.update(DELETE_SQL);
        Timestamp updatedAt = Timestamp.from(clock.instant());
        int chunkSize = Math.max(1, properties.getInsertChunkSize());
        int written = 0;
        for (int from = 0; from < rows.size(); from += chunkSize) {
            List<SimilarityRow> chunk = rows.subList(from, Math.min(rows.size(), from + chunkSize));
            jdbcTemplate.batchUpdate(
                INSERT_SQL,
                chunk,
                chunk.size(),
                (ps, row) -> {
                    ps.setString(1, row.sourceId());
                    ps.setString(2, row.neighborId());
                    ps.setDouble(3, row.similarity());
                    ps.setInt(4, row.commonUsers());
                    ps.setTimestamp(5, updatedAt);
                }
            );
            written += chunk.size();
        }
        logger.info("item_item_sim rewritten deleted={} inserted={} chunk_size={}", deleted, written, chunkSize);
        return written;
    }
}
