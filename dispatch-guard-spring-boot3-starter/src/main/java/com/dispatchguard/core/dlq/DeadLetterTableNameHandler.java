package com.dispatchguard.core.dlq;

import com.baomidou.mybatisplus.extension.plugins.handler.TableNameHandler;
import com.dispatchguard.model.DeadLetterStoreOptions;

/**
 * 把 SQL 中的逻辑表名 dead_letter_entries 改写为配置的 schema.table
 * 应用自定义了 MybatisPlusInterceptor 时需自行注册:
 * interceptor.addInnerInterceptor(new DynamicTableNameInnerInterceptor(new DeadLetterTableNameHandler(options)))
 */
public class DeadLetterTableNameHandler implements TableNameHandler {

    public static final String LOGICAL_TABLE = "dead_letter_entries";

    private final String qualified;

    public DeadLetterTableNameHandler(DeadLetterStoreOptions options) {
        this.qualified = options.qualifiedTableName();
    }

    @Override
    public String dynamicTableName(String sql, String tableName) {
        return LOGICAL_TABLE.equalsIgnoreCase(tableName) ? qualified : tableName;
    }
}
