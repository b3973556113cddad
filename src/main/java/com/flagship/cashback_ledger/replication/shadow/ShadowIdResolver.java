package com.flagship.cashback_ledger.replication.shadow;

import com.flagship.cashback_ledger.common.BoundedCache;
import com.flagship.cashback_ledger.common.EntityId;
import com.flagship.cashback_ledger.replication.ReplicatedEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps primary-store ids to shadow-store UUIDs and back.
 *
 * Hits are cached; misses are not, so a row replicated a moment later is
 * found on the next lookup.
 */
@Component
@Slf4j
public class ShadowIdResolver {

    private static final long CACHE_CAPACITY = 5000;
    private static final Duration CACHE_TTL = Duration.ofMinutes(10);

    private final JdbcTemplate jdbcTemplate;
    private final BoundedCache<String, UUID> shadowIds = new BoundedCache<>(CACHE_CAPACITY, CACHE_TTL);
    private final BoundedCache<String, String> foreignIds = new BoundedCache<>(CACHE_CAPACITY, CACHE_TTL);

    public ShadowIdResolver(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<UUID> shadowIdOf(ReplicatedEntity entity, String foreignId) {
        if (foreignId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(shadowIds.get(key(entity, foreignId), k -> {
            List<UUID> rows = jdbcTemplate.queryForList(
                    "SELECT id FROM " + entity.getShadowTable() + " WHERE mongo_id = ?", UUID.class, foreignId);
            return rows.isEmpty() ? null : rows.get(0);
        }));
    }

    public Optional<String> foreignIdOf(ReplicatedEntity entity, UUID shadowId) {
        if (shadowId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(foreignIds.get(key(entity, shadowId.toString()), k -> {
            List<String> rows = jdbcTemplate.queryForList(
                    "SELECT mongo_id FROM " + entity.getShadowTable() + " WHERE id = ?", String.class, shadowId);
            return rows.isEmpty() ? null : rows.get(0);
        }));
    }

    /**
     * Resolves an API id to the primary-store id. Legacy ids are already
     * primary ids; native ids are looked up in the shadow table.
     */
    public Optional<String> resolve(ReplicatedEntity entity, EntityId id) {
        if (!id.isNative()) {
            return Optional.of(id.getValue());
        }
        Optional<String> foreignId = foreignIdOf(entity, id.asUuid());
        if (foreignId.isEmpty()) {
            log.debug("No {} shadow row with id {}", entity.getLabel(), id.getValue());
        }
        return foreignId;
    }

    void evict(ReplicatedEntity entity, String foreignId) {
        shadowIds.get(key(entity, foreignId))
                .ifPresent(uuid -> foreignIds.invalidate(key(entity, uuid.toString())));
        shadowIds.invalidate(key(entity, foreignId));
    }

    private static String key(ReplicatedEntity entity, String id) {
        return entity.name() + ":" + id;
    }
}
