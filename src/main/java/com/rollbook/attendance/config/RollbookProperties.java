package com.rollbook.attendance.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Configuration properties for Rollbook.
 */
@Data
@ConfigurationProperties(prefix = "rollbook")
public class RollbookProperties {

    /**
     * Access token configuration
     */
    private TokenConfig token = new TokenConfig();

    /**
     * Report thresholds
     */
    private ReportConfig report = new ReportConfig();

    /**
     * Demo data seeding
     */
    private SeedConfig seed = new SeedConfig();

    /**
     * Cross-origin configuration
     */
    private CorsConfig cors = new CorsConfig();

    @Data
    public static class TokenConfig {
        /**
         * HMAC secret used to sign access tokens.
         * In production, use environment variable: ROLLBOOK_TOKEN_SECRET
         */
        private String secret;

        /**
         * Issuer claim written into and required from every token
         */
        private String issuer = "rollbook";

        /**
         * Token lifetime in hours
         */
        private int expirationHours = 24;
    }

    @Data
    public static class ReportConfig {
        /**
         * Students strictly below this attendance percentage count as "below threshold"
         */
        private double belowThresholdPercent = 75.0;

        /**
         * Students strictly below this attendance percentage count as chronically absent
         */
        private double chronicAbsenceThresholdPercent = 50.0;
    }

    @Data
    public static class SeedConfig {
        /**
         * Register POST /dev/seed. Keep disabled outside demo environments.
         */
        private boolean enabled = false;

        private String teacherName = "Demo Teacher";

        private String teacherEmail = "teacher@demo.com";

        private String teacherPassword = "teacher@demo.com";

        private String className = "Class 5-A";
    }

    @Data
    public static class CorsConfig {
        /**
         * Origins allowed to call the API from a browser
         */
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
