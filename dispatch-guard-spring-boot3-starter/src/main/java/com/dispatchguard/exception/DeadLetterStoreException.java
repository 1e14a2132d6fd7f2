package com.dispatchguard.exception;

/**
 * 死信存储层异常（连接失败、语句超时等）
 * 消息中带上目标 id 或操作名, 便于排查
 */
public class DeadLetterStoreException extends RuntimeException {

    public DeadLetterStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
