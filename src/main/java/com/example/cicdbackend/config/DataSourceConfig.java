package com.example.cicdbackend.config;

import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Builds the connection pool from DATABASE_URL when it is set.
 * Without it the regular spring.datasource.* auto-configuration is used.
 */
@Slf4j
@Configuration
@Conditional(DatabaseUrlConfiguredCondition.class)
public class DataSourceConfig {

    static final int POOL_SIZE = 5;
    static final int MAX_OVERFLOW = 10;

    @Bean
    public DataSource dataSource(BackendProperties properties) {
        DatabaseUrl url = DatabaseUrl.parse(properties.getDatabaseUrl());
        log.info("Using store at {}", url);

        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("cicd-store");
        dataSource.setJdbcUrl(url.jdbcUrl());
        if (url.username() != null) dataSource.setUsername(url.username());
        if (url.password() != null) dataSource.setPassword(url.password());
        dataSource.setMinimumIdle(POOL_SIZE);
        dataSource.setMaximumPoolSize(POOL_SIZE + MAX_OVERFLOW);
        dataSource.setConnectionTestQuery("SELECT 1");
        return dataSource;
    }
}
