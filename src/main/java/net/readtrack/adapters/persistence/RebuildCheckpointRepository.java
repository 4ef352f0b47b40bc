package net.readtrack.adapters.persistence;

import java.util.List;
import java.util.Optional;
import net.readtrack.domain.timeline.EntityKey;
import net.readtrack.domain.timeline.EntityType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Stores the last entity key a rebuild job committed, so an interrupted run can resume.
 */
@Repository
public class RebuildCheckpointRepository {

    private final JdbcTemplate jdbcTemplate;

    public RebuildCheckpointRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<EntityKey> find(String jobName) {
        List<EntityKey> rows = jdbcTemplate.query(
            "SELECT last_entity_type, last_entity_id FROM timeline_rebuild_checkpoints WHERE job_name = ?",
            (rs, rowNum) -> EntityKey.of(
                EntityType.requireDbValue(rs.getString("last_entity_type")),
                rs.getLong("last_entity_id")
            ),
            jobName
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /**
     * Records {@code lastKey} as committed. Runs inside the batch transaction it describes.
     */
    public void save(String jobName, EntityKey lastKey) {
        jdbcTemplate.update("""
            INSERT INTO timeline_rebuild_checkpoints (job_name, last_entity_type, last_entity_id, updated_at)
            VALUES (?, ?, ?, NOW())
            ON CONFLICT (job_name) DO UPDATE
               SET last_entity_type = EXCLUDED.last_entity_type,
                   last_entity_id = EXCLUDED.last_entity_id,
                   updated_at = EXCLUDED.updated_at
            """, jobName, lastKey.entityType().dbValue(), lastKey.entityId());
    }

    public void clear(String jobName) {
        jdbcTemplate.update("DELETE FROM timeline_rebuild_checkpoints WHERE job_name = ?", jobName);
    }
}
