package com.example.compliance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the compliance engine.
 */
@ConfigurationProperties(prefix = "compliance")
public record ComplianceProperties(
        Report report,
        Evaluation evaluation
) {

    public ComplianceProperties {
        if (report == null) report = new Report(0);
        if (evaluation == null) evaluation = new Evaluation(0);
    }

    /**
     * Report generation settings.
     *
     * @param recommendationLimit How many of the most frequent recommendations to keep (default 10)
     */
    public record Report(int recommendationLimit) {
        public Report {
            if (recommendationLimit <= 0) recommendationLimit = 10;
        }
    }

    /**
     * Evaluation worker pool settings.
     *
     * @param parallelism Worker threads used for per-entity evaluation (default: available processors)
     */
    public record Evaluation(int parallelism) {
        public Evaluation {
            if (parallelism <= 0) parallelism = Runtime.getRuntime().availableProcessors();
        }
    }
}
