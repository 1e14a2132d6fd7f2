package com.dispatchguard.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 表名在运行时由 DynamicTableNameInnerInterceptor 改写为 schema.table
 */
@TableName("dead_letter_entries")
@Data
public class DeadLetterEntryEntity {

    /** UUID 字符串 */
    @TableId(type = IdType.INPUT)
    private String id;

    private String messageType;

    /** JSON 载荷 */
    private byte[] payload;

    /** DeadLetterReason 名称 */
    private String reason;

    private String exceptionMessage;

    private String exceptionStackTrace;

    /** UTC */
    private LocalDateTime enqueuedAt;

    private Integer originalAttempts;

    /** JSON 对象 */
    private String metadata;

    private String correlationId;

    private String causationId;

    private String sourceQueue;

    @TableField("is_replayed")
    private Boolean replayed;

    /** UTC */
    private LocalDateTime replayedAt;

    /** 重放租约到期时间, 非空表示有进程正在重放 */
    private LocalDateTime replayLeaseExpireAt;
}
