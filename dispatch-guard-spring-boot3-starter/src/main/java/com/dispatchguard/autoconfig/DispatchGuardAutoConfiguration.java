package com.dispatchguard.autoconfig;

import com.dispatchguard.config.DispatchGuardProperties;
import com.dispatchguard.core.backoff.BackoffCalculatorFactory;
import com.dispatchguard.core.circuit.DefaultCircuitBreaker;
import com.dispatchguard.core.circuit.Resilience4jCircuitBreakerAdapter;
import com.dispatchguard.core.dispatch.ResilientDispatcher;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.notify.LoggingCircuitStateListener;
import com.dispatchguard.core.registry.DefaultTransportCircuitBreakerRegistry;
import com.dispatchguard.core.registry.NoOpTransportCircuitBreakerRegistry;
import com.dispatchguard.core.retry.DefaultRetryPolicy;
import com.dispatchguard.core.retry.NoOpRetryPolicy;
import com.dispatchguard.core.spi.CircuitBreakerFactory;
import com.dispatchguard.core.spi.CircuitStateListener;
import com.dispatchguard.core.spi.DeadLetterQueue;
import com.dispatchguard.core.spi.MessageBus;
import com.dispatchguard.core.spi.RetryPolicy;
import com.dispatchguard.core.spi.TransportCircuitBreakerRegistry;
import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.RetryPolicyOptions;
import com.dispatchguard.model.enums.BackoffStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 熔断注册表、重试策略与派发器
 */
@AutoConfiguration(after = {DispatchGuardMetricsAutoConfiguration.class, DeadLetterAutoConfiguration.class})
@EnableConfigurationProperties(DispatchGuardProperties.class)
public class DispatchGuardAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DispatchGuardAutoConfiguration.class);

    /**
     * 熔断实现: native(默认) | resilience4j
     */
    @Bean
    @ConditionalOnMissingBean
    public CircuitBreakerFactory circuitBreakerFactory(DispatchGuardProperties props) {
        if (props.getCircuitBreaker().getProvider() == DispatchGuardProperties.Provider.RESILIENCE4J) {
            return Resilience4jCircuitBreakerAdapter::new;
        }
        return DefaultCircuitBreaker::new;
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingCircuitStateListener loggingCircuitStateListener() {
        return new LoggingCircuitStateListener();
    }

    /**
     * 容器中所有 CircuitStateListener 都会挂到注册表上
     */
    @Bean
    @ConditionalOnMissingBean
    public TransportCircuitBreakerRegistry transportCircuitBreakerRegistry(DispatchGuardProperties props,
                                                                           CircuitBreakerFactory factory,
                                                                           ObjectProvider<CircuitStateListener> listeners) {
        if (!props.isEnabled()) {
            log.info("[DispatchGuard] disabled, circuit breaking is a no-op");
            return NoOpTransportCircuitBreakerRegistry.INSTANCE;
        }
        DispatchGuardProperties.CbConfig cb = props.getCircuitBreaker();
        CircuitBreakerOptions defaults = toOptions(cb);
        Map<String, CircuitBreakerOptions> overrides = new HashMap<>();
        cb.getPerTransport().forEach((name, o) -> overrides.put(name, merge(defaults, o)));

        DefaultTransportCircuitBreakerRegistry registry =
                new DefaultTransportCircuitBreakerRegistry(defaults, overrides, factory);
        listeners.orderedStream().forEach(registry::addListener);
        log.info("[DispatchGuard] circuit registry ready: provider={}, failureThreshold={}, openDuration={}ms, "
                        + "successThreshold={}, overrides={}",
                cb.getProvider(), cb.getFailureThreshold(), cb.getOpenDuration().toMillis(),
                cb.getSuccessThreshold(), overrides.keySet());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy retryPolicy(DispatchGuardProperties props, ObjectProvider<GuardMetrics> metrics) {
        if (!props.isEnabled() || !props.getRetry().isEnabled()) {
            log.info("[DispatchGuard] retry disabled, operations run once");
            return NoOpRetryPolicy.INSTANCE;
        }
        RetryPolicyOptions options = toOptions(props.getRetry());
        return new DefaultRetryPolicy(options, BackoffCalculatorFactory.create(options), metrics.getIfAvailable());
    }

    /**
     * 仅在应用提供了 MessageBus 时创建
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MessageBus.class)
    public ResilientDispatcher resilientDispatcher(MessageBus bus,
                                                   RetryPolicy retryPolicy,
                                                   TransportCircuitBreakerRegistry registry,
                                                   DeadLetterQueue dlq,
                                                   ObjectProvider<GuardMetrics> metrics) {
        return new ResilientDispatcher(bus, retryPolicy, registry, dlq, metrics.getIfAvailable(GuardMetrics::noop));
    }

    static CircuitBreakerOptions toOptions(DispatchGuardProperties.CbConfig c) {
        return CircuitBreakerOptions.builder()
                .failureThreshold(c.getFailureThreshold())
                .openDuration(c.getOpenDuration())
                .successThreshold(c.getSuccessThreshold())
                .build();
    }

    static CircuitBreakerOptions merge(CircuitBreakerOptions defaults, DispatchGuardProperties.CbOverride o) {
        return CircuitBreakerOptions.builder()
                .failureThreshold(o.getFailureThreshold() != null ? o.getFailureThreshold() : defaults.getFailureThreshold())
                .openDuration(o.getOpenDuration() != null ? o.getOpenDuration() : defaults.getOpenDuration())
                .successThreshold(o.getSuccessThreshold() != null ? o.getSuccessThreshold() : defaults.getSuccessThreshold())
                .build();
    }

    static RetryPolicyOptions toOptions(DispatchGuardProperties.RetryConfig r) {
        return RetryPolicyOptions.builder()
                .maxRetryAttempts(r.getMaxRetryAttempts())
                .baseDelay(r.getBaseDelay())
                .maxDelay(r.getMaxDelay())
                .backoffMultiplier(r.getBackoffMultiplier())
                .jitterEnabled(r.isJitterEnabled())
                .jitterFactor(r.getJitterFactor())
                .strategy(BackoffStrategy.from(r.getStrategy()))
                .retriableExceptions(resolve(r.getRetriableExceptions()))
                .nonRetriableExceptions(resolve(r.getNonRetriableExceptions()))
                .build();
    }

    /**
     * 全限定类名 -> 异常类型; 找不到或不是 Throwable 时启动失败
     */
    static Set<Class<? extends Throwable>> resolve(List<String> names) {
        Set<Class<? extends Throwable>> out = new HashSet<>();
        if (names == null) {
            return out;
        }
        ClassLoader cl = DispatchGuardAutoConfiguration.class.getClassLoader();
        for (String name : names) {
            Class<?> type;
            try {
                type = ClassUtils.forName(name.trim(), cl);
            } catch (ClassNotFoundException | LinkageError e) {
                throw new IllegalArgumentException("unknown exception class: " + name, e);
            }
            if (!Throwable.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(name + " is not a Throwable");
            }
            out.add(type.asSubclass(Throwable.class));
        }
        return out;
    }
}
