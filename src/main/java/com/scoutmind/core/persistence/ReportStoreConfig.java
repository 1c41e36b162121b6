package com.scoutmind.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link ReportStore}.
 * <p>
 * When {@code scoutmind.persistence.url} is set (the {@code postgres} profile
 * sets it from {@code DATABASE_URL}) reports go to the database through a
 * {@link JdbcReportStore}. Otherwise an {@link InMemoryReportStore} is used.
 */
@Configuration
public class ReportStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ReportStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "scoutmind.persistence", name = "url")
    public DataSource reportDataSource(PersistenceProperties properties) {
        log.info("Configuring report DataSource for {}", properties.getUrl());
        return DataSourceBuilder.create()
                .url(properties.getUrl())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "scoutmind.persistence", name = "url")
    public ReportStore jdbcReportStore(DataSource reportDataSource) throws Exception {
        log.info("Configuring JDBC report store");
        var store = new JdbcReportStore(reportDataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(ReportStore.class)
    public ReportStore inMemoryReportStore() {
        log.info("No database configured; reports are kept in memory");
        return new InMemoryReportStore();
    }
}
