package dev.campfire.job;

import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** Body of {@code POST /jobs} on the extraction collaborator. */
public record ExtractionRequest(
    UUID jobId,
    UUID sourceId,
    String url,
    List<String> additionalUrls,
    @Nullable String parsingNotes,
    String callbackUrl) {}
