package dev.campfire.dedup;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one deduplication batch.
 *
 * @param scanned candidates read from the catalog
 * @param merged groups that had at least one duplicate folded into their survivor
 * @param deleted rows deleted: merged duplicates plus purged placeholder locations
 * @param repointed foreign references moved onto survivors
 * @param failedGroups groups whose merge failed and was rolled back
 * @param continuation cursor for the next batch; null once the catalog is exhausted
 */
public record DedupResult(
    DedupKind kind,
    int scanned,
    int merged,
    int deleted,
    int repointed,
    int failedGroups,
    @Nullable String continuation) {

  public boolean exhausted() {
    return continuation == null;
  }
}
