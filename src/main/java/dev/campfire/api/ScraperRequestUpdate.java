package dev.campfire.api;

import dev.campfire.discovery.ScraperRequestStatus;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

public record ScraperRequestUpdate(@NotNull ScraperRequestStatus status, @Nullable String notes) {}
