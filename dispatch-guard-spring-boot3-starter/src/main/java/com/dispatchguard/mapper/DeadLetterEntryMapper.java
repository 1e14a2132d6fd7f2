package com.dispatchguard.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dispatchguard.model.entity.DeadLetterEntryEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

@Mapper
public interface DeadLetterEntryMapper extends BaseMapper<DeadLetterEntryEntity> {

    /**
     * 抢占重放租约: 仅未重放且无有效租约时成功, 返回 1 表示抢到
     * 租约过期后可被再次抢占, 进程在重放途中退出时条目不会永久卡住
     */
    @Update("""
        UPDATE dead_letter_entries
           SET replay_lease_expire_at = #{leaseUntil}
         WHERE id = #{id}
           AND is_replayed = FALSE
           AND (replay_lease_expire_at IS NULL OR replay_lease_expire_at <= #{now})
        """)
    int claimForReplay(@Param("id") String id,
                       @Param("now") LocalDateTime now,
                       @Param("leaseUntil") LocalDateTime leaseUntil);

    /**
     * 重放成功: is_replayed 只会从 FALSE 变为 TRUE 一次
     */
    @Update("""
        UPDATE dead_letter_entries
           SET is_replayed = TRUE,
               replayed_at = #{replayedAt},
               replay_lease_expire_at = NULL
         WHERE id = #{id}
           AND is_replayed = FALSE
        """)
    int markReplayed(@Param("id") String id, @Param("replayedAt") LocalDateTime replayedAt);

    /**
     * 重放失败, 释放租约
     */
    @Update("""
        UPDATE dead_letter_entries
           SET replay_lease_expire_at = NULL
         WHERE id = #{id}
           AND is_replayed = FALSE
        """)
    int releaseReplayClaim(@Param("id") String id);
}
