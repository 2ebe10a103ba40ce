package com.di.snapdiff.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Connection pool and schema for the JDBC stores. Active unless snapdiff.manifest.store=memory.
 * The DDL is idempotent and runs on every start.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "snapdiff.manifest.store", havingValue = "jdbc", matchIfMissing = true)
public class StoreConfiguration {

    static final String SCHEMA = "schema/snapdiff-schema.sql";

    @Bean(destroyMethod = "close")
    public HikariDataSource snapdiffDataSource(SnapDiffProperties properties) {
        SnapDiffProperties.Datasource ds = properties.getManifest().getDatasource();
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(ds.getUrl());
        hikariConfig.setUsername(ds.getUsername());
        hikariConfig.setPassword(ds.getPassword());
        hikariConfig.setDriverClassName(ds.getDriverClassName());
        hikariConfig.setMaximumPoolSize(ds.getMaximumPoolSize());
        // each manifest write is its own statement; no surrounding transaction
        hikariConfig.setAutoCommit(true);
        hikariConfig.setPoolName("HikariPool-snapdiff");
        log.info("[MANIFEST] datasource {} (maxPoolSize={})", sanitizeUrl(ds.getUrl()), hikariConfig.getMaximumPoolSize());
        HikariDataSource dataSource = new HikariDataSource(hikariConfig);
        initSchema(dataSource);
        return dataSource;
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource snapdiffDataSource) {
        return new JdbcTemplate(snapdiffDataSource);
    }

    static void initSchema(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("[MANIFEST] schema {} applied", SCHEMA);
    }

    private static String sanitizeUrl(String jdbcUrl) {
        return jdbcUrl == null ? "null" : jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
