package com.dispatchguard.core.spi;

import com.dispatchguard.model.CircuitBreakerOptions;
import com.dispatchguard.model.enums.CircuitState;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 按传输/目的地名称管理熔断器, 名称大小写不敏感
 * 同一名称只会存在一个熔断器实例, 不同名称之间互不影响
 */
public interface TransportCircuitBreakerRegistry extends AutoCloseable {

    /** 获取或使用默认参数（含按名称覆盖的参数）创建 */
    CircuitBreaker getOrCreate(String transportName);

    /** 获取或使用给定参数创建; 已存在时参数被忽略 */
    CircuitBreaker getOrCreate(String transportName, CircuitBreakerOptions options);

    Optional<CircuitBreaker> tryGet(String transportName);

    boolean remove(String transportName);

    void resetAll();

    /** 当前所有熔断器状态的快照 */
    Map<String, CircuitState> getAllStates();

    Set<String> getTransportNames();

    int count();

    /** 订阅本注册表已有及之后创建的所有熔断器的状态变更 */
    void addListener(CircuitStateListener listener);

    void removeListener(CircuitStateListener listener);

    @Override
    void close();
}
