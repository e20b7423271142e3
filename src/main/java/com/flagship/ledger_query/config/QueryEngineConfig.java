package com.flagship.ledger_query.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;

/**
 * Configuration of the ledger query engine.
 *
 * Properties (application.yml):
 * - ledger.query.default-limit: page size when none or a negative one is requested
 * - ledger.query.max-limit: page size ceiling for non-root requesters
 * - ledger.query.grouping-window: time bucket of the grouping order
 * - ledger.query.executor.pool-size: threads resolving account references concurrently
 */
@Configuration
@Slf4j
public class QueryEngineConfig {

    @Value("${ledger.query.default-limit:100}")
    private int defaultLimit;

    @Value("${ledger.query.max-limit:10000}")
    private int maxLimit;

    @Value("${ledger.query.grouping-window:10s}")
    private Duration groupingWindow;

    @Value("${ledger.query.executor.pool-size:8}")
    private int poolSize;

    @Bean
    public QueryEngineSettings queryEngineSettings() {
        if (defaultLimit < 0 || maxLimit < defaultLimit) {
            throw new IllegalStateException(String.format(
                "Invalid ledger query limits: default-limit=%d, max-limit=%d", defaultLimit, maxLimit));
        }
        log.info("Ledger query engine: defaultLimit={}, maxLimit={}, groupingWindow={}",
            defaultLimit, maxLimit, groupingWindow);
        return new QueryEngineSettings(defaultLimit, maxLimit, groupingWindow);
    }

    @Bean(name = "ledgerQueryExecutor")
    public ThreadPoolTaskExecutor ledgerQueryExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("ledger-query-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
}
