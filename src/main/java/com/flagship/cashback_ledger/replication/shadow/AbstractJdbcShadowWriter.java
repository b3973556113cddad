package com.flagship.cashback_ledger.replication.shadow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.cashback_ledger.common.exception.ReplicationFailureException;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import com.flagship.cashback_ledger.replication.ShadowWriter;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * JDBC plumbing shared by the shadow writers: version lookups, id paging,
 * deletes, timestamp and JSONB conversion.
 */
abstract class AbstractJdbcShadowWriter<D> implements ShadowWriter<D> {

    protected final JdbcTemplate jdbcTemplate;
    protected final ObjectMapper objectMapper;
    protected final ShadowIdResolver idResolver;
    private final ReplicatedEntity entity;

    protected AbstractJdbcShadowWriter(ReplicatedEntity entity,
                                       JdbcTemplate jdbcTemplate,
                                       ObjectMapper objectMapper,
                                       ShadowIdResolver idResolver) {
        this.entity = entity;
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.idResolver = idResolver;
    }

    @Override
    public void delete(String foreignId) {
        jdbcTemplate.update("DELETE FROM " + entity.getShadowTable() + " WHERE mongo_id = ?", foreignId);
        idResolver.evict(entity, foreignId);
    }

    @Override
    public Map<String, Long> shadowVersions(Collection<String> foreignIds) {
        if (foreignIds.isEmpty()) {
            return Collections.emptyMap();
        }
        String placeholders = String.join(",", Collections.nCopies(foreignIds.size(), "?"));
        Map<String, Long> versions = new HashMap<>();
        jdbcTemplate.query(
                "SELECT mongo_id, source_version FROM " + entity.getShadowTable() + " WHERE mongo_id IN (" + placeholders + ")",
                rs -> {
                    versions.put(rs.getString("mongo_id"), rs.getLong("source_version"));
                },
                foreignIds.toArray());
        return versions;
    }

    @Override
    public List<String> shadowIdsAfter(String afterForeignId, int limit) {
        String table = entity.getShadowTable();
        if (afterForeignId == null) {
            return jdbcTemplate.queryForList(
                    "SELECT mongo_id FROM " + table + " ORDER BY mongo_id LIMIT ?", String.class, limit);
        }
        return jdbcTemplate.queryForList(
                "SELECT mongo_id FROM " + table + " WHERE mongo_id > ? ORDER BY mongo_id LIMIT ?",
                String.class, afterForeignId, limit);
    }

    protected ReplicatedEntity entity() {
        return entity;
    }

    protected static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    protected String json(String foreignId, Object value) {
        try {
            return objectMapper.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new ReplicationFailureException(entity.getLabel(), foreignId, "cannot serialize to JSON", e);
        }
    }
}
