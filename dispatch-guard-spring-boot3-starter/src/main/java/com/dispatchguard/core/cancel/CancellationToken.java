package com.dispatchguard.core.cancel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 协作式取消信号
 * - 由调用方持有并在任意线程调用 {@link #cancel()}
 * - 被保护的操作与重试间隔的等待都会观察该信号
 * - 取消只会发生一次, 不可撤销
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private static final CancellationToken NONE = new CancellationToken() {
        @Override
        public void cancel() {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }

        /** 永不触发, 不保留回调 */
        @Override
        public void onCancel(Runnable callback) {
            Objects.requireNonNull(callback, "callback");
        }
    };

    private final CountDownLatch latch = new CountDownLatch(1);

    private final Object lock = new Object();

    /** 取消后置为 null, 登记与触发都在 lock 内判定, 保证每个回调恰好执行一次 */
    private List<Runnable> callbacks = new ArrayList<>();

    /** 永不取消的信号 */
    public static CancellationToken none() {
        return NONE;
    }

    /** 已取消的信号 */
    public static CancellationToken cancelled() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        return token;
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (callbacks == null) {
                return;
            }
            toRun = callbacks;
            callbacks = null;
            latch.countDown();
        }
        for (Runnable cb : toRun) {
            try {
                cb.run();
            } catch (RuntimeException e) {
                log.warn("[Cancellation] callback failed", e);
            }
        }
    }

    public boolean isCancellationRequested() {
        return latch.getCount() == 0;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("operation was cancelled");
        }
    }

    /**
     * 注册取消回调; 已取消则立即执行
     */
    public void onCancel(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (callbacks != null) {
                callbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    /**
     * 可取消的等待
     * 等待期间收到取消或线程被中断时抛出 {@link CancellationException}
     */
    public void await(Duration delay) {
        throwIfCancellationRequested();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            if (latch.await(delay.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("operation was cancelled while waiting");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException ce = new CancellationException("interrupted while waiting");
            ce.initCause(e);
            throw ce;
        }
    }
}
