package com.tasflow.config;

import com.tasflow.ingest.MovieParser;
import com.tasflow.integration.UnconfiguredMovieParser;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core beans of the submission workflow.
 */
@Configuration
public class WorkflowConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fallback used until a deployment registers the byte-level movie parsers.
     */
    @Bean
    @ConditionalOnMissingBean
    public MovieParser movieParser() {
        return new UnconfiguredMovieParser();
    }
}
