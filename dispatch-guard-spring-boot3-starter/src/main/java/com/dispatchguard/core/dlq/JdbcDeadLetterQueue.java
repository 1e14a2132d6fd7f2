package com.dispatchguard.core.dlq;

import com.baomidou.mybatisplus.core.conditions.query.QueryWrapper;
import com.dispatchguard.core.spi.MessageSerializer;
import com.dispatchguard.exception.DeadLetterStoreException;
import com.dispatchguard.mapper.DeadLetterEntryMapper;
import com.dispatchguard.model.DeadLetterStoreOptions;
import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.dlq.DeadLetterQueryFilter;
import com.dispatchguard.model.entity.DeadLetterEntryEntity;
import com.dispatchguard.model.enums.DeadLetterReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 基于 MyBatis-Plus 的死信存储
 * 时间字段以 UTC 的 LocalDateTime 落库; 重放先抢占 replay_lease_expire_at 租约, 处理成功后才写 is_replayed
 */
public class JdbcDeadLetterQueue extends AbstractDeadLetterQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcDeadLetterQueue.class);

    private final DeadLetterStoreOptions options;

    private final DeadLetterEntryMapper mapper;

    public JdbcDeadLetterQueue(DeadLetterStoreOptions options, DeadLetterEntryMapper mapper, MessageSerializer serializer) {
        this(options, mapper, serializer, Clock.systemUTC());
    }

    public JdbcDeadLetterQueue(DeadLetterStoreOptions options, DeadLetterEntryMapper mapper,
                               MessageSerializer serializer, Clock clock) {
        super(serializer, clock);
        this.options = Objects.requireNonNull(options, "options");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        // 提前校验 schema/table
        options.qualifiedTableName();
    }

    public DeadLetterStoreOptions getOptions() {
        return options;
    }

    @Override
    protected void store(DeadLetterEntry entry) {
        try {
            mapper.insert(toEntity(entry));
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("insert dead letter failed, id=" + entry.getId(), e);
        }
    }

    @Override
    protected Optional<DeadLetterEntry> claim(UUID id) {
        String key = id.toString();
        Instant now = clock.instant();
        try {
            if (mapper.claimForReplay(key, toDb(now), toDb(now.plus(options.getReplayLeaseTimeout()))) != 1) {
                return Optional.empty();
            }
            return Optional.ofNullable(mapper.selectById(key)).map(this::toEntry);
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("claim dead letter for replay failed, id=" + id, e);
        }
    }

    @Override
    protected void markReplayed(UUID id, Instant replayedAt) {
        int n;
        try {
            n = mapper.markReplayed(id.toString(), toDb(replayedAt));
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("mark dead letter replayed failed, id=" + id, e);
        }
        if (n != 1) {
            // 租约过期后已被其他进程重放成功
            log.warn("[DLQ] replay of id={} was already confirmed elsewhere", id);
        }
    }

    @Override
    protected void release(UUID id) {
        try {
            mapper.releaseReplayClaim(id.toString());
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("release replay claim failed, id=" + id, e);
        }
    }

    @Override
    public Optional<DeadLetterEntry> getEntry(UUID id) {
        Objects.requireNonNull(id, "id");
        try {
            return Optional.ofNullable(mapper.selectById(id.toString())).map(this::toEntry);
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("get dead letter failed, id=" + id, e);
        }
    }

    @Override
    public List<DeadLetterEntry> getEntries(DeadLetterQueryFilter filter, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        DeadLetterQueryFilter f = filter == null ? DeadLetterQueryFilter.all() : filter;
        QueryWrapper<DeadLetterEntryEntity> qw = where(f)
                .orderByDesc("enqueued_at")
                .last("LIMIT " + limit + " OFFSET " + Math.max(0, f.getSkip()));
        try {
            List<DeadLetterEntryEntity> rows = mapper.selectList(qw);
            List<DeadLetterEntry> out = new ArrayList<>(rows.size());
            rows.forEach(r -> out.add(toEntry(r)));
            return out;
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("query dead letters failed, filter=" + f, e);
        }
    }

    @Override
    public long getCount(DeadLetterQueryFilter filter) {
        DeadLetterQueryFilter f = filter == null ? DeadLetterQueryFilter.all() : filter;
        try {
            Long n = mapper.selectCount(where(f));
            return n == null ? 0L : n;
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("count dead letters failed, filter=" + f, e);
        }
    }

    @Override
    public boolean purge(UUID id) {
        Objects.requireNonNull(id, "id");
        try {
            return mapper.deleteById(id.toString()) > 0;
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("purge dead letter failed, id=" + id, e);
        }
    }

    @Override
    public int purgeOlderThan(Duration age) {
        Objects.requireNonNull(age, "age");
        LocalDateTime cutoff = toDb(clock.instant().minus(age));
        try {
            int n = mapper.delete(new QueryWrapper<DeadLetterEntryEntity>().lt("enqueued_at", cutoff));
            if (n > 0) {
                log.info("[DLQ] purged {} entries enqueued before {}", n, cutoff);
            }
            return n;
        } catch (RuntimeException e) {
            throw new DeadLetterStoreException("purge dead letters older than " + age + " failed", e);
        }
    }

    /** 清理超过保留期的条目 */
    public int purgeExpired() {
        return purgeOlderThan(options.getRetention());
    }

    private QueryWrapper<DeadLetterEntryEntity> where(DeadLetterQueryFilter f) {
        QueryWrapper<DeadLetterEntryEntity> qw = new QueryWrapper<>();
        qw.like(f.getMessageType() != null, "message_type", f.getMessageType())
                .eq(f.getReason() != null, "reason", f.getReason() == null ? null : f.getReason().name())
                .ge(f.getFromDate() != null, "enqueued_at", f.getFromDate() == null ? null : toDb(f.getFromDate()))
                .le(f.getToDate() != null, "enqueued_at", f.getToDate() == null ? null : toDb(f.getToDate()))
                .eq(f.getReplayed() != null, "is_replayed", f.getReplayed())
                .eq(f.getSourceQueue() != null, "source_queue", f.getSourceQueue())
                .eq(f.getCorrelationId() != null, "correlation_id", f.getCorrelationId())
                .ge(f.getMinAttempts() != null, "original_attempts", f.getMinAttempts());
        return qw;
    }

    private DeadLetterEntryEntity toEntity(DeadLetterEntry e) {
        DeadLetterEntryEntity row = new DeadLetterEntryEntity();
        row.setId(e.getId().toString());
        row.setMessageType(e.getMessageType());
        row.setPayload(e.getPayload());
        row.setReason(e.getReason().name());
        row.setExceptionMessage(e.getExceptionMessage());
        row.setExceptionStackTrace(e.getExceptionStackTrace());
        row.setEnqueuedAt(toDb(e.getEnqueuedAt()));
        row.setOriginalAttempts(e.getOriginalAttempts());
        row.setMetadata(writeMetadata(e.getMetadata()));
        row.setCorrelationId(e.getCorrelationId());
        row.setCausationId(e.getCausationId());
        row.setSourceQueue(e.getSourceQueue());
        row.setReplayed(e.isReplayed());
        row.setReplayedAt(e.getReplayedAt() == null ? null : toDb(e.getReplayedAt()));
        row.setReplayLeaseExpireAt(null);
        return row;
    }

    private DeadLetterEntry toEntry(DeadLetterEntryEntity row) {
        return DeadLetterEntry.builder()
                .id(UUID.fromString(row.getId()))
                .messageType(row.getMessageType())
                .payload(row.getPayload())
                .reason(parseReason(row.getReason()))
                .exceptionMessage(row.getExceptionMessage())
                .exceptionStackTrace(row.getExceptionStackTrace())
                .enqueuedAt(fromDb(row.getEnqueuedAt()))
                .originalAttempts(row.getOriginalAttempts() == null ? 0 : row.getOriginalAttempts())
                .metadata(readMetadata(row.getMetadata()))
                .correlationId(row.getCorrelationId())
                .causationId(row.getCausationId())
                .sourceQueue(row.getSourceQueue())
                .replayed(Boolean.TRUE.equals(row.getReplayed()))
                .replayedAt(row.getReplayedAt() == null ? null : fromDb(row.getReplayedAt()))
                .build();
    }

    private String writeMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        return new String(serializer.serialize(metadata), StandardCharsets.UTF_8);
    }

    private Map<String, String> readMetadata(String json) {
        Map<String, String> out = new HashMap<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        Map<?, ?> raw = serializer.deserialize(json.getBytes(StandardCharsets.UTF_8), Map.class);
        if (raw != null) {
            raw.forEach((k, v) -> out.put(String.valueOf(k), v == null ? null : String.valueOf(v)));
        }
        return out;
    }

    private static DeadLetterReason parseReason(String name) {
        if (name == null) {
            return DeadLetterReason.UNKNOWN;
        }
        try {
            return DeadLetterReason.valueOf(name);
        } catch (IllegalArgumentException e) {
            log.warn("[DLQ] unknown reason '{}' in store, mapped to UNKNOWN", name);
            return DeadLetterReason.UNKNOWN;
        }
    }

    private static LocalDateTime toDb(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromDb(LocalDateTime time) {
        return time.toInstant(ZoneOffset.UTC);
    }
}
