package com.dispatchguard.annotation;

import java.lang.annotation.*;

/**
 * 标注在任意配置类上, 覆盖 dispatch.guard.dlq.purge.enabled
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableDispatchGuard {

    /**
     * 是否启动死信定期清理
     */
    boolean purge() default true;
}
