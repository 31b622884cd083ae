package dev.campfire.job;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Published inside the trigger transaction once a job holds its source's lease. */
public record JobClaimedEvent(
    UUID jobId,
    UUID sourceId,
    String url,
    List<String> additionalUrls,
    @Nullable String parsingNotes) {}
