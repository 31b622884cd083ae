package dev.campfire.validation;

import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/** Publication status of a catalog session. */
public enum SessionStatus {
  ACTIVE,
  DRAFT,
  PENDING_REVIEW;

  static final int REVIEW_THRESHOLD = 50;

  private static final Pattern FREE = Pattern.compile("\\bfree\\b", Pattern.CASE_INSENSITIVE);

  /**
   * Sessions below 50% completeness go to review. A zero price without an explicit "free" marker is
   * treated as a parsing failure and held as a draft even when complete.
   */
  public static SessionStatus of(
      int completenessScore, @Nullable Integer priceInCents, @Nullable String priceRaw) {
    if (completenessScore < REVIEW_THRESHOLD) {
      return PENDING_REVIEW;
    }
    if (priceInCents != null
        && priceInCents == 0
        && (priceRaw == null || !FREE.matcher(priceRaw).find())) {
      return DRAFT;
    }
    return completenessScore == 100 ? ACTIVE : DRAFT;
  }
}
