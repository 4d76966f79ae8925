package com.dockeriot.ingestion.config;

import com.dockeriot.common.config.DatabaseSettings;
import com.dockeriot.common.config.DatabaseSettingsLoader;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import javax.sql.DataSource;

/**
 * Resolves the PostgreSQL connection once at startup and owns the pool for the
 * lifetime of the process. A {@link com.dockeriot.common.config.ConfigurationException}
 * here aborts context refresh, so the service never starts serving without credentials.
 */
@Configuration
@Slf4j
public class DatabaseConfig {

    @Bean
    public DatabaseSettings databaseSettings(Environment environment) {
        return DatabaseSettingsLoader.load(environment::getProperty);
    }

    @Bean
    public DataSource dataSource(DatabaseSettings settings) {
        log.info("Creating connection pool for {}", settings.jdbcUrl());
        return DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .driverClassName("org.postgresql.Driver")
                .url(settings.jdbcUrl())
                .username(settings.getUser())
                .password(settings.getPassword())
                .build();
    }
}
