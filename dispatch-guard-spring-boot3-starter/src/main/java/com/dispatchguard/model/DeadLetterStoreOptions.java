package com.dispatchguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 关系型死信存储参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterStoreOptions {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Builder.Default
    private String schema = "dispatch";

    @Builder.Default
    private String table = "dead_letter_entries";

    /** 语句超时 */
    @Builder.Default
    private Duration commandTimeout = Duration.ofSeconds(30);

    /** 重放租约时长, 超时未确认的抢占可被再次抢占 */
    @Builder.Default
    private Duration replayLeaseTimeout = Duration.ofMinutes(5);

    /** 超过保留期的条目由 purgeExpired 清理 */
    @Builder.Default
    private Duration retention = Duration.ofDays(30);

    public static DeadLetterStoreOptions defaults() {
        return new DeadLetterStoreOptions();
    }

    /** schema.table, 两段都必须是合法标识符 */
    public String qualifiedTableName() {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("invalid dead letter schema: " + schema);
        }
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("invalid dead letter table: " + table);
        }
        return schema + "." + table;
    }
}
