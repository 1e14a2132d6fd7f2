package com.dispatchguard.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * dispatch:
 *   guard:
 *     enabled: true
 *     circuit-breaker:
 *       provider: native            # native | resilience4j
 *       failure-threshold: 5
 *       open-duration: 30s
 *       success-threshold: 3
 *       per-transport:
 *         "[orders.queue]": { failure-threshold: 2, open-duration: 5s }
 *     retry:
 *       enabled: true
 *       max-retry-attempts: 3
 *       base-delay: 1s
 *       max-delay: 30s
 *       backoff-multiplier: 2.0
 *       jitter-enabled: true
 *       jitter-factor: 0.1
 *       strategy: exponential       # fixed | linear | exponential | exponential-with-jitter
 *       retriable-exceptions: [java.io.IOException]
 *       non-retriable-exceptions: [java.lang.IllegalArgumentException]
 *     dlq:
 *       store: memory               # memory | jdbc
 *       jdbc:
 *         schema: dispatch
 *         table: dead_letter_entries
 *         command-timeout: 30s
 *         retention: 30d
 *         replay-lease-timeout: 5m
 *       purge:
 *         enabled: false
 *         initial-delay: 1m
 *         period: 1h
 */
@Data
@ConfigurationProperties(prefix = "dispatch.guard")
public class DispatchGuardProperties {

    /** 总开关, 关闭后使用空注册表与不重试策略 */
    private boolean enabled = true;

    private CbConfig circuitBreaker = new CbConfig();

    private RetryConfig retry = new RetryConfig();

    private DlqConfig dlq = new DlqConfig();

    public enum Provider {
        NATIVE, RESILIENCE4J
    }

    public enum StoreType {
        MEMORY, JDBC
    }

    @Data
    public static class CbConfig {
        private Provider provider = Provider.NATIVE;
        private int failureThreshold = 5;
        private Duration openDuration = Duration.ofSeconds(30);
        private int successThreshold = 3;
        /** 按传输名称覆盖, 未配置的字段沿用默认值 */
        private Map<String, CbOverride> perTransport = new HashMap<>();
    }

    @Data
    public static class CbOverride {
        private Integer failureThreshold;
        private Duration openDuration;
        private Integer successThreshold;
    }

    @Data
    public static class RetryConfig {
        private boolean enabled = true;
        private int maxRetryAttempts = 3;
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private boolean jitterEnabled = true;
        private double jitterFactor = 0.1;
        private String strategy = "exponential";
        /** 全限定类名 */
        private List<String> retriableExceptions = new ArrayList<>();
        private List<String> nonRetriableExceptions = new ArrayList<>();
    }

    @Data
    public static class DlqConfig {
        private StoreType store = StoreType.MEMORY;
        private Jdbc jdbc = new Jdbc();
        private Purge purge = new Purge();
    }

    @Data
    public static class Jdbc {
        private String schema = "dispatch";
        private String table = "dead_letter_entries";
        private Duration commandTimeout = Duration.ofSeconds(30);
        private Duration retention = Duration.ofDays(30);
        private Duration replayLeaseTimeout = Duration.ofMinutes(5);
    }

    @Data
    public static class Purge {
        private boolean enabled = false;
        private Duration initialDelay = Duration.ofMinutes(1);
        private Duration period = Duration.ofHours(1);
    }
}
