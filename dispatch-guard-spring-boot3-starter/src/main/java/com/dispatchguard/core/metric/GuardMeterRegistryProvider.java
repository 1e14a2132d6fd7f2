package com.dispatchguard.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;

/**
 * 合并容器中发现的 MeterRegistry, 并以 SimpleMeterRegistry 兜底
 */
public class GuardMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    public GuardMeterRegistryProvider(List<MeterRegistry> discovered) {
        composite.add(new SimpleMeterRegistry());
        if (discovered == null) {
            return;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry) {
                ((CompositeMeterRegistry) mr).getRegistries().forEach(composite::add);
            } else {
                composite.add(mr);
            }
        }
    }

    public MeterRegistry getRegistry() {
        return composite;
    }
}
