package dev.campfire.catalog;

import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Where extracted sessions land: the source that produced them and its owning organization and city.
 * Without an organization, sessions are stored without camp or location links.
 */
public record SessionTarget(
    UUID sourceId, @Nullable UUID organizationId, @Nullable UUID cityId) {}
