package dev.campfire.job;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job scheduling settings bound from {@code campfire.jobs.*}.
 *
 * @param defaultTimeout how long a job may run when its source has no timeout override
 * @param timeoutSweepInterval delay between timeout sweeps
 * @param dueSourceInterval delay between due-source scans
 * @param dueSourceBatchSize maximum jobs triggered per due-source scan
 */
@ConfigurationProperties(prefix = "campfire.jobs")
public record JobProperties(
    Duration defaultTimeout,
    Duration timeoutSweepInterval,
    Duration dueSourceInterval,
    int dueSourceBatchSize) {}
