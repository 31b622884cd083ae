package dev.campfire.dedup;

/** What merging one group changed. */
record MergeOutcome(int deleted, int repointed) {

  static final MergeOutcome NONE = new MergeOutcome(0, 0);

  boolean merged() {
    return deleted > 0;
  }
}
