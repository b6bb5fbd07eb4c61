package com.example.hoopstats_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Enables the analysis, scoring and evaluation properties.
 */
@Configuration
@EnableConfigurationProperties({AnalysisProperties.class, ScoringProperties.class, EvaluationProperties.class})
public class AppPropertiesConfig {
}
