package com.dispatchguard.core.dlq;

import com.dispatchguard.core.serializer.JacksonMessageSerializer;
import com.dispatchguard.core.spi.MessageSerializer;
import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.dlq.DeadLetterQueryFilter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * 进程内死信队列, 重启即丢失, 适合测试与单机场景
 */
public class InMemoryDeadLetterQueue extends AbstractDeadLetterQueue {

    private final ConcurrentHashMap<UUID, Slot> entries = new ConcurrentHashMap<>();

    public InMemoryDeadLetterQueue() {
        this(new JacksonMessageSerializer(), Clock.systemUTC());
    }

    public InMemoryDeadLetterQueue(MessageSerializer serializer, Clock clock) {
        super(serializer, clock);
    }

    @Override
    protected void store(DeadLetterEntry entry) {
        entries.put(entry.getId(), new Slot(copy(entry)));
    }

    @Override
    protected Optional<DeadLetterEntry> claim(UUID id) {
        Slot slot = entries.get(id);
        if (slot == null || !slot.claimed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        return Optional.of(slot.entry);
    }

    @Override
    protected void markReplayed(UUID id, Instant replayedAt) {
        Slot slot = entries.get(id);
        if (slot != null) {
            slot.entry = slot.entry.toBuilder().replayed(true).replayedAt(replayedAt).build();
        }
    }

    @Override
    protected void release(UUID id) {
        Slot slot = entries.get(id);
        if (slot != null) {
            slot.claimed.set(false);
        }
    }

    @Override
    public Optional<DeadLetterEntry> getEntry(UUID id) {
        Objects.requireNonNull(id, "id");
        Slot slot = entries.get(id);
        return slot == null ? Optional.empty() : Optional.of(copy(slot.entry));
    }

    @Override
    public List<DeadLetterEntry> getEntries(DeadLetterQueryFilter filter, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        DeadLetterQueryFilter f = filter == null ? DeadLetterQueryFilter.all() : filter;
        return entries.values().stream()
                .map(s -> s.entry)
                .filter(f::matches)
                .sorted(Comparator.comparing(DeadLetterEntry::getEnqueuedAt).reversed())
                .skip(Math.max(0, f.getSkip()))
                .limit(limit)
                .map(InMemoryDeadLetterQueue::copy)
                .collect(Collectors.toList());
    }

    @Override
    public long getCount(DeadLetterQueryFilter filter) {
        DeadLetterQueryFilter f = filter == null ? DeadLetterQueryFilter.all() : filter;
        return entries.values().stream().map(s -> s.entry).filter(f::matches).count();
    }

    @Override
    public boolean purge(UUID id) {
        Objects.requireNonNull(id, "id");
        return entries.remove(id) != null;
    }

    @Override
    public int purgeOlderThan(Duration age) {
        Objects.requireNonNull(age, "age");
        Instant cutoff = clock.instant().minus(age);
        int removed = 0;
        for (UUID id : entries.keySet()) {
            Slot slot = entries.get(id);
            if (slot != null && slot.entry.getEnqueuedAt().isBefore(cutoff) && entries.remove(id, slot)) {
                removed++;
            }
        }
        return removed;
    }

    /** 外部拿到的是副本, 不会影响队列内部状态 */
    private static DeadLetterEntry copy(DeadLetterEntry e) {
        return e.toBuilder()
                .payload(e.getPayload() == null ? null : e.getPayload().clone())
                .metadata(new HashMap<>(e.getMetadata()))
                .build();
    }

    private static final class Slot {

        private final AtomicBoolean claimed = new AtomicBoolean(false);

        private volatile DeadLetterEntry entry;

        private Slot(DeadLetterEntry entry) {
            this.entry = entry;
        }
    }
}
