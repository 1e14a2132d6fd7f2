package com.dispatchguard.autoconfig;

import com.dispatchguard.core.metric.GuardMeterRegistryProvider;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.notify.MetricsCircuitStateListener;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
public class DispatchGuardMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public GuardMeterRegistryProvider guardMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new GuardMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public GuardMetrics guardMetrics(GuardMeterRegistryProvider provider) {
        return GuardMetrics.create(provider.getRegistry());
    }

    /**
     * 熔断状态变更计数
     */
    @Bean
    @ConditionalOnMissingBean
    public MetricsCircuitStateListener metricsCircuitStateListener(GuardMetrics metrics) {
        return new MetricsCircuitStateListener(metrics);
    }
}
