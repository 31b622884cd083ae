package dev.campfire.job;

import org.jspecify.annotations.Nullable;

/** Whether the extraction collaborator accepted a job. */
public record DispatchResult(boolean accepted, @Nullable String error) {

  static DispatchResult ok() {
    return new DispatchResult(true, null);
  }

  static DispatchResult failed(String error) {
    return new DispatchResult(false, error);
  }
}
