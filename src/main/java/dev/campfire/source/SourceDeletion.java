package dev.campfire.source;

import java.util.UUID;

/**
 * Result of deleting a source.
 *
 * @param sessionsUnlinked sessions kept in the catalog with their source reference cleared
 * @param sessionsDeleted sessions removed because a cascading delete was requested
 */
public record SourceDeletion(UUID sourceId, int sessionsUnlinked, int sessionsDeleted) {}
