package dev.campfire.discovery;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/** A URL reported by the search collaborator. */
public record NewDiscovery(
    String url,
    @Nullable String title,
    @Nullable String snippet,
    @Nullable String discoveryQuery,
    @Nullable UUID cityId) {}
