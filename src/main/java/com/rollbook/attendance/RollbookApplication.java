package com.rollbook.attendance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.rollbook.attendance.config.RollbookProperties;

/**
 * Rollbook - school attendance backend.
 *
 * Teachers sign in, maintain class rosters, submit one attendance sheet per class
 * per day and pull attendance statistics over date ranges.
 */
@SpringBootApplication
@EnableConfigurationProperties(RollbookProperties.class)
public class RollbookApplication {

    public static void main(String[] args) {
        SpringApplication.run(RollbookApplication.class, args);
    }
}
