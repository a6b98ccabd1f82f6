package com.rollbook.attendance.config;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;

import javax.sql.DataSource;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import lombok.extern.slf4j.Slf4j;

/**
 * The process-wide connection pool.
 *
 * Built once at startup and closed by the container on shutdown. A connection
 * is opened straight away so a misconfigured store shows up in the startup log;
 * the application still starts if it fails and the health endpoint reports DOWN.
 */
@Slf4j
@Configuration
public class DataStoreConfig {

    @Bean
    @Primary
    public DataSource dataSource(DataSourceProperties properties) {
        String url = properties.determineUrl();

        DataSource dataSource = DataSourceBuilder.create()
                .url(url)
                .username(properties.determineUsername())
                .password(properties.determinePassword() != null ? properties.determinePassword() : "")
                .driverClassName(properties.determineDriverClassName())
                .build();

        verifyConnection(dataSource, url);
        return dataSource;
    }

    private void verifyConnection(DataSource dataSource, String url) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData meta = connection.getMetaData();
            log.info("Connected to data store {} {} at {}",
                    meta.getDatabaseProductName(), meta.getDatabaseProductVersion(), url);
        } catch (SQLException | RuntimeException e) {
            // pool initialization failures surface unchecked
            log.error("Could not connect to data store at {}: {}", url, e.getMessage(), e);
        }
    }
}
