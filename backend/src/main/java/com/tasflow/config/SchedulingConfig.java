package com.tasflow.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the outbox poll. Tests switch it off and drain the outbox explicitly.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "tasflow.outbox.scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
