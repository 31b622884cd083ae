package dev.campfire.api;

import org.jspecify.annotations.Nullable;

/**
 * Optional body of operator actions naming who performed them.
 *
 * @param reason free text, used by rescan requests
 */
public record ActorRequest(@Nullable String actor, @Nullable String reason) {

  static final String DEFAULT_ACTOR = "operator";

  static String actorOf(@Nullable ActorRequest request) {
    return request == null || request.actor() == null || request.actor().isBlank()
        ? DEFAULT_ACTOR
        : request.actor().trim();
  }
}
