package dev.campfire.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Enables the background schedulers (due-source trigger, job timeout sweep, dedup sweep).
 *
 * <p>Integration tests switch them off with {@code campfire.scheduling.enabled=false} so that
 * scheduled work never races the test's own calls.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(
    prefix = "campfire.scheduling",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class SchedulingConfig {}
