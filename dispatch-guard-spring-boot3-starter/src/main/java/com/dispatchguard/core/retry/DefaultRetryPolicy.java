package com.dispatchguard.core.retry;

import com.dispatchguard.core.backoff.BackoffCalculatorFactory;
import com.dispatchguard.core.cancel.CancellationToken;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.spi.BackoffCalculator;
import com.dispatchguard.core.spi.GuardedOperation;
import com.dispatchguard.core.spi.RetryPolicy;
import com.dispatchguard.exception.CircuitBreakerOpenException;
import com.dispatchguard.model.RetryPolicyOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * 有界重试
 * 判定优先级: 取消 > 不可重试 > 可重试 > 次数耗尽
 * 异常按具体类型精确匹配; 两个集合都为空时除取消与熔断打开外全部可重试
 */
public class DefaultRetryPolicy implements RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetryPolicy.class);

    private final RetryPolicyOptions options;

    private final BackoffCalculator backoff;

    private final GuardMetrics metrics;

    public DefaultRetryPolicy(RetryPolicyOptions options) {
        this(options, BackoffCalculatorFactory.create(options), null);
    }

    public DefaultRetryPolicy(RetryPolicyOptions options, BackoffCalculator backoff) {
        this(options, backoff, null);
    }

    public DefaultRetryPolicy(RetryPolicyOptions options, BackoffCalculator backoff, GuardMetrics metrics) {
        this.options = Objects.requireNonNull(options, "options");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.metrics = metrics;
    }

    public RetryPolicyOptions getOptions() {
        return options;
    }

    @Override
    public <T> T execute(GuardedOperation<T> operation, CancellationToken token) throws Exception {
        Objects.requireNonNull(operation, "operation");
        CancellationToken ct = token == null ? CancellationToken.none() : token;
        int maxAttempts = Math.max(1, options.getMaxRetryAttempts());

        for (int attempt = 1; ; attempt++) {
            // 首次执行总会发生, 由操作自身观察取消
            if (attempt > 1) {
                ct.throwIfCancellationRequested();
            }
            try {
                return operation.execute(ct);
            } catch (CancellationException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                if (ct.isCancellationRequested()) {
                    CancellationException ce = new CancellationException("operation cancelled on attempt " + attempt);
                    ce.initCause(e);
                    throw ce;
                }
                if (!isRetriable(e)) {
                    log.debug("[Retry] attempt={} non-retriable failure type={}", attempt, e.getClass().getName());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("[Retry] exhausted after {} attempts, lastError={}", attempt, e.toString());
                    throw e;
                }
                Duration delay = backoff.calculateDelay(attempt);
                log.warn("[Retry] attempt={}/{} failed, retry in {}ms (backoff={}), cause={}",
                        attempt, maxAttempts, delay.toMillis(), backoff.name(), e.toString());
                if (metrics != null) {
                    metrics.incRetry();
                }
                ct.await(delay);
            }
        }
    }

    @Override
    public boolean isRetriable(Throwable failure) {
        if (failure == null || isCancellation(failure)) {
            return false;
        }
        Class<? extends Throwable> type = failure.getClass();
        if (options.getNonRetriableExceptions() != null && options.getNonRetriableExceptions().contains(type)) {
            return false;
        }
        if (options.getRetriableExceptions() != null && !options.getRetriableExceptions().isEmpty()) {
            return options.getRetriableExceptions().contains(type);
        }
        // 熔断打开是快速失败信号, 未显式声明时不重试
        return !(failure instanceof CircuitBreakerOpenException);
    }

    static boolean isCancellation(Throwable t) {
        return t instanceof CancellationException || t instanceof InterruptedException;
    }
}
