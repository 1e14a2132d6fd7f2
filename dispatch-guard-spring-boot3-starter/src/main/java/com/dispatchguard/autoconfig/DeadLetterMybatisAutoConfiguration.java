package com.dispatchguard.autoconfig;

import com.baomidou.mybatisplus.autoconfigure.ConfigurationCustomizer;
import com.baomidou.mybatisplus.autoconfigure.MybatisPlusAutoConfiguration;
import com.baomidou.mybatisplus.extension.plugins.MybatisPlusInterceptor;
import com.baomidou.mybatisplus.extension.plugins.inner.DynamicTableNameInnerInterceptor;
import com.baomidou.mybatisplus.extension.spring.MybatisSqlSessionFactoryBean;
import com.dispatchguard.config.DispatchGuardProperties;
import com.dispatchguard.core.dlq.DeadLetterTableNameHandler;
import com.dispatchguard.core.dlq.JdbcDeadLetterQueue;
import com.dispatchguard.core.metric.GuardMetrics;
import com.dispatchguard.core.serializer.JacksonMessageSerializer;
import com.dispatchguard.core.spi.DeadLetterQueue;
import com.dispatchguard.core.spi.DeadLetterReplayHandler;
import com.dispatchguard.core.spi.MessageSerializer;
import com.dispatchguard.mapper.DeadLetterEntryMapper;
import com.dispatchguard.model.DeadLetterStoreOptions;
import org.apache.ibatis.session.SqlSessionFactory;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * dispatch.guard.dlq.store=jdbc 时启用的关系型死信存储
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class, before = MybatisPlusAutoConfiguration.class)
@ConditionalOnClass({
        SqlSessionFactory.class,
        MybatisSqlSessionFactoryBean.class
})
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "dispatch.guard.dlq", name = "store", havingValue = "jdbc")
@EnableConfigurationProperties(DispatchGuardProperties.class)
@MapperScan(basePackages = "com.dispatchguard.mapper")
public class DeadLetterMybatisAutoConfiguration {

    @Bean
    public DeadLetterStoreOptions deadLetterStoreOptions(DispatchGuardProperties props) {
        DispatchGuardProperties.Jdbc jdbc = props.getDlq().getJdbc();
        return DeadLetterStoreOptions.builder()
                .schema(jdbc.getSchema())
                .table(jdbc.getTable())
                .commandTimeout(jdbc.getCommandTimeout())
                .retention(jdbc.getRetention())
                .replayLeaseTimeout(jdbc.getReplayLeaseTimeout())
                .build();
    }

    /**
     * 表名改写; 应用已有拦截器时不覆盖, 见 {@link DeadLetterTableNameHandler}
     */
    @Bean
    @ConditionalOnMissingBean(MybatisPlusInterceptor.class)
    public MybatisPlusInterceptor dispatchGuardMybatisPlusInterceptor(DeadLetterStoreOptions options) {
        MybatisPlusInterceptor interceptor = new MybatisPlusInterceptor();
        interceptor.addInnerInterceptor(new DynamicTableNameInnerInterceptor(new DeadLetterTableNameHandler(options)));
        return interceptor;
    }

    /**
     * 语句超时
     */
    @Bean
    public ConfigurationCustomizer deadLetterStatementTimeoutCustomizer(DeadLetterStoreOptions options) {
        int seconds = (int) Math.max(1, options.getCommandTimeout().toSeconds());
        return configuration -> configuration.setDefaultStatementTimeout(seconds);
    }

    @Bean
    @ConditionalOnMissingBean(DeadLetterQueue.class)
    public JdbcDeadLetterQueue jdbcDeadLetterQueue(DeadLetterStoreOptions options,
                                                   DeadLetterEntryMapper mapper,
                                                   ObjectProvider<MessageSerializer> serializer,
                                                   ObjectProvider<DeadLetterReplayHandler> replayHandler,
                                                   ObjectProvider<GuardMetrics> metrics) {
        JdbcDeadLetterQueue dlq = new JdbcDeadLetterQueue(options, mapper,
                serializer.getIfAvailable(JacksonMessageSerializer::new));
        DeadLetterAutoConfiguration.wire(dlq, replayHandler, metrics);
        return dlq;
    }
}
