package com.dispatchguard.core.dlq;

import com.baomidou.mybatisplus.core.conditions.Wrapper;
import com.dispatchguard.core.serializer.JacksonMessageSerializer;
import com.dispatchguard.exception.DeadLetterStoreException;
import com.dispatchguard.mapper.DeadLetterEntryMapper;
import com.dispatchguard.model.DeadLetterStoreOptions;
import com.dispatchguard.model.dlq.DeadLetterEntry;
import com.dispatchguard.model.entity.DeadLetterEntryEntity;
import com.dispatchguard.model.enums.DeadLetterReason;
import com.dispatchguard.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JdbcDeadLetterQueueTest {

    @Mock
    private DeadLetterEntryMapper mapper;

    private MutableClock clock;

    private JdbcDeadLetterQueue dlq;

    private AtomicInteger handled;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T12:00:00Z");
        dlq = new JdbcDeadLetterQueue(DeadLetterStoreOptions.defaults(), mapper, new JacksonMessageSerializer(), clock);
        handled = new AtomicInteger();
        dlq.setReplayHandler(m -> handled.incrementAndGet());
    }

    @Test
    void enqueueInsertsRowWithUtcTimesAndJsonMetadata() {
        when(mapper.insert(any(DeadLetterEntryEntity.class))).thenReturn(1);

        UUID id = dlq.enqueue("payload", DeadLetterReason.MAX_RETRIES_EXCEEDED, new IOException("boom"),
                Map.of(DeadLetterEntry.KEY_CORRELATION_ID, "corr", DeadLetterEntry.KEY_ATTEMPTS, "3"));

        ArgumentCaptor<DeadLetterEntryEntity> captor = ArgumentCaptor.forClass(DeadLetterEntryEntity.class);
        verify(mapper).insert(captor.capture());
        DeadLetterEntryEntity row = captor.getValue();
        assertEquals(id.toString(), row.getId());
        assertEquals("MAX_RETRIES_EXCEEDED", row.getReason());
        assertEquals(LocalDateTime.of(2024, 3, 1, 12, 0), row.getEnqueuedAt());
        assertEquals(3, row.getOriginalAttempts());
        assertEquals("corr", row.getCorrelationId());
        assertEquals(Boolean.FALSE, row.getReplayed());
        assertNull(row.getReplayedAt());
        assertNull(row.getReplayLeaseExpireAt());
        assertTrue(row.getMetadata().contains("\"CorrelationId\":\"corr\""));
    }

    @Test
    void enqueuePropagatesStoreFailure() {
        when(mapper.insert(any(DeadLetterEntryEntity.class))).thenThrow(new IllegalStateException("db down"));

        DeadLetterStoreException e = assertThrows(DeadLetterStoreException.class,
                () -> dlq.enqueue("payload", DeadLetterReason.UNKNOWN));
        assertEquals("db down", e.getCause().getMessage());
    }

    @Test
    void replayTakesLeaseAndMarksReplayedOnlyAfterHandlerSucceeds() {
        UUID id = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.of(2024, 3, 1, 12, 0);
        when(mapper.claimForReplay(id.toString(), now, now.plusMinutes(5))).thenReturn(1);
        when(mapper.selectById(id.toString())).thenReturn(row(id, "MAX_RETRIES_EXCEEDED", "{\"k\":\"v\"}"));
        when(mapper.markReplayed(id.toString(), now)).thenReturn(1);
        dlq.setReplayHandler(m -> {
            // 处理器执行期间条目仍是未重放状态
            verify(mapper, never()).markReplayed(anyString(), any(LocalDateTime.class));
            handled.incrementAndGet();
        });

        assertTrue(dlq.replay(id));

        assertEquals(1, handled.get());
        verify(mapper).markReplayed(id.toString(), now);
        verify(mapper, never()).releaseReplayClaim(anyString());
    }

    @Test
    void replayLeaseFollowsConfiguredTimeout() {
        dlq = new JdbcDeadLetterQueue(DeadLetterStoreOptions.builder().replayLeaseTimeout(Duration.ofSeconds(30)).build(),
                mapper, new JacksonMessageSerializer(), clock);
        dlq.setReplayHandler(m -> handled.incrementAndGet());
        UUID id = UUID.randomUUID();
        LocalDateTime now = LocalDateTime.of(2024, 3, 1, 12, 0);
        when(mapper.claimForReplay(id.toString(), now, now.plusSeconds(30))).thenReturn(0);

        assertFalse(dlq.replay(id));

        verify(mapper).claimForReplay(id.toString(), now, now.plusSeconds(30));
    }

    @Test
    void replayLosingClaimDoesNotInvokeHandler() {
        UUID id = UUID.randomUUID();
        when(mapper.claimForReplay(eq(id.toString()), any(LocalDateTime.class), any(LocalDateTime.class))).thenReturn(0);

        assertFalse(dlq.replay(id));

        assertEquals(0, handled.get());
        verify(mapper, never()).selectById(anyString());
    }

    @Test
    void failedReplayReleasesLeaseWithoutMarkingReplayed() {
        UUID id = UUID.randomUUID();
        when(mapper.claimForReplay(eq(id.toString()), any(LocalDateTime.class), any(LocalDateTime.class))).thenReturn(1);
        when(mapper.selectById(id.toString())).thenReturn(row(id, "MAX_RETRIES_EXCEEDED", null));
        dlq.setReplayHandler(m -> {
            throw new IOException("still broken");
        });

        assertFalse(dlq.replay(id));

        verify(mapper).releaseReplayClaim(id.toString());
        verify(mapper, never()).markReplayed(anyString(), any(LocalDateTime.class));
    }

    @Test
    void markReplayedFailureIsWrapped() {
        UUID id = UUID.randomUUID();
        when(mapper.claimForReplay(eq(id.toString()), any(LocalDateTime.class), any(LocalDateTime.class))).thenReturn(1);
        when(mapper.selectById(id.toString())).thenReturn(row(id, "MAX_RETRIES_EXCEEDED", null));
        when(mapper.markReplayed(eq(id.toString()), any(LocalDateTime.class))).thenThrow(new IllegalStateException("db down"));

        assertThrows(DeadLetterStoreException.class, () -> dlq.replay(id));
        assertEquals(1, handled.get());
    }

    @Test
    void getEntriesMapsRows() {
        UUID id = UUID.randomUUID();
        when(mapper.selectList(anyWrapper())).thenReturn(List.of(row(id, "SOMETHING_FROM_THE_FUTURE", "{\"k\":\"v\"}")));

        List<DeadLetterEntry> entries = dlq.getEntries(null, 10);

        assertEquals(1, entries.size());
        DeadLetterEntry e = entries.get(0);
        assertEquals(id, e.getId());
        assertEquals(DeadLetterReason.UNKNOWN, e.getReason());
        assertEquals("v", e.getMetadata().get("k"));
        assertEquals(clock.instant().minusSeconds(60), e.getEnqueuedAt());
        assertEquals("hello", new String(e.getPayload(), StandardCharsets.UTF_8));
        assertThrows(IllegalArgumentException.class, () -> dlq.getEntries(null, -1));
    }

    @Test
    void getCountTreatsNullAsZero() {
        when(mapper.selectCount(anyWrapper())).thenReturn(null);

        assertEquals(0L, dlq.getCount(null));
    }

    @Test
    void storageFailuresAreWrapped() {
        UUID id = UUID.randomUUID();
        when(mapper.selectById(id.toString())).thenThrow(new IllegalStateException("db down"));

        DeadLetterStoreException e = assertThrows(DeadLetterStoreException.class, () -> dlq.getEntry(id));
        assertEquals("db down", e.getCause().getMessage());
    }

    @Test
    void purgeDelegatesToMapper() {
        UUID id = UUID.randomUUID();
        when(mapper.deleteById(id.toString())).thenReturn(1);
        when(mapper.delete(anyWrapper())).thenReturn(7);

        assertTrue(dlq.purge(id));
        assertEquals(7, dlq.purgeOlderThan(Duration.ofDays(1)));
        assertEquals(7, dlq.purgeExpired());
    }

    @Test
    void invalidTableNameIsRejectedAtConstruction() {
        DeadLetterStoreOptions options = DeadLetterStoreOptions.builder().table("entries; drop table x").build();

        assertThrows(IllegalArgumentException.class,
                () -> new JdbcDeadLetterQueue(options, mapper, new JacksonMessageSerializer(), clock));
    }

    private static Wrapper<DeadLetterEntryEntity> anyWrapper() {
        return any();
    }

    private DeadLetterEntryEntity row(UUID id, String reason, String metadata) {
        DeadLetterEntryEntity r = new DeadLetterEntryEntity();
        r.setId(id.toString());
        r.setMessageType("java.lang.String");
        r.setPayload("hello".getBytes(StandardCharsets.UTF_8));
        r.setReason(reason);
        r.setEnqueuedAt(LocalDateTime.of(2024, 3, 1, 11, 59));
        r.setOriginalAttempts(2);
        r.setMetadata(metadata);
        r.setReplayed(false);
        return r;
    }
}
