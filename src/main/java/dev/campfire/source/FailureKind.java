package dev.campfire.source;

/** Why an extraction attempt failed, as far as source health is concerned. */
public enum FailureKind {
  /** Network, rate limit or a temporarily broken page. Counts toward backoff only. */
  TRANSIENT,
  /** The extractor no longer understands the page layout. Flags the source for regeneration. */
  STRUCTURAL,
  /** The job ran past its timeout. */
  TIMEOUT,
  /** An operator cancelled the job. */
  CANCELLED;

  public boolean requiresRegeneration() {
    return this == STRUCTURAL;
  }
}
