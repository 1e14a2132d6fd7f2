package com.dispatchguard.autoconfig;

import com.dispatchguard.annotation.EnableDispatchGuard;
import com.dispatchguard.config.DispatchGuardProperties;
import com.dispatchguard.core.dlq.AbstractDeadLetterQueue;
import com.dispatchguard.core.dlq.DeadLetterPurgeLifecycle;
import com.dispatchguard.core.dlq.InMemoryDeadLetterQueue;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.serializer.JacksonMessageSerializer;
import com.dispatchguard.core.spi.DeadLetterQueue;
import com.dispatchguard.core.spi.DeadLetterReplayHandler;
import com.dispatchguard.core.spi.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Clock;

/**
 * 死信队列与定期清理
 * 未注册其他 DeadLetterQueue 时回退到进程内实现
 */
@AutoConfiguration(after = {DispatchGuardMetricsAutoConfiguration.class, DeadLetterMybatisAutoConfiguration.class})
@EnableConfigurationProperties(DispatchGuardProperties.class)
public class DeadLetterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterAutoConfiguration.class);

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(MessageSerializer.class)
    public MessageSerializer messageSerializer() {
        return new JacksonMessageSerializer();
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterQueue.class)
    public InMemoryDeadLetterQueue inMemoryDeadLetterQueue(DispatchGuardProperties props,
                                                           MessageSerializer serializer,
                                                           ObjectProvider<DeadLetterReplayHandler> replayHandler,
                                                           ObjectProvider<GuardMetrics> metrics) {
        if (props.getDlq().getStore() == DispatchGuardProperties.StoreType.JDBC) {
            log.warn("[DLQ] store=jdbc requested but no DataSource/MyBatis-Plus available, falling back to memory");
        }
        InMemoryDeadLetterQueue dlq = new InMemoryDeadLetterQueue(serializer, Clock.systemUTC());
        wire(dlq, replayHandler, metrics);
        return dlq;
    }

    /**
     * 死信定期清理; @EnableDispatchGuard(purge = ...) 优先于配置
     */
    @Bean
    @ConditionalOnMissingBean
    public DeadLetterPurgeLifecycle deadLetterPurgeLifecycle(DeadLetterQueue dlq,
                                                             DispatchGuardProperties props,
                                                             ApplicationContext applicationContext) {
        DispatchGuardProperties.Purge purge = props.getDlq().getPurge();
        EnableDispatchGuard enable = findEnableDispatchGuard(applicationContext);
        boolean enabled = enable != null ? enable.purge() : purge.isEnabled();
        return new DeadLetterPurgeLifecycle(dlq, props.getDlq().getJdbc().getRetention(),
                purge.getInitialDelay(), purge.getPeriod(), enabled);
    }

    static void wire(AbstractDeadLetterQueue dlq,
                     ObjectProvider<DeadLetterReplayHandler> replayHandler,
                     ObjectProvider<GuardMetrics> metrics) {
        dlq.setReplayHandler(replayHandler.getIfAvailable());
        dlq.setMetrics(metrics.getIfAvailable());
    }

    private static EnableDispatchGuard findEnableDispatchGuard(ListableBeanFactory factory) {
        for (String n : factory.getBeanDefinitionNames()) {
            Class<?> type = factory.getType(n, false);
            if (type == null) continue;
            EnableDispatchGuard an = AnnotationUtils.findAnnotation(type, EnableDispatchGuard.class);
            if (an != null) return an;
        }
        return null;
    }
}
