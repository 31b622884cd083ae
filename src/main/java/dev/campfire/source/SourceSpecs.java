package dev.campfire.source;

import dev.campfire.catalog.CampSession;
import dev.campfire.validation.SessionStatus;
import jakarta.persistence.criteria.Root;
import jakarta.persistence.criteria.Subquery;
import java.util.UUID;
import org.jspecify.annotations.Nullable;
import org.springframework.data.jpa.domain.Specification;

/** Query predicates behind the operator source list. */
final class SourceSpecs {

  private SourceSpecs() {}

  /** Sources in one city; every source when {@code cityId} is null. */
  static Specification<Source> inCity(@Nullable UUID cityId) {
    return (root, query, cb) ->
        cityId == null ? cb.conjunction() : cb.equal(root.get("cityId"), cityId);
  }

  static Specification<Source> matching(SourceFilter filter) {
    return switch (filter) {
      case ALL -> (root, query, cb) -> cb.conjunction();
      case HEALTHY ->
          (root, query, cb) ->
              cb.and(
                  cb.isTrue(root.get("active")),
                  cb.lessThan(
                      root.get("health").get("consecutiveFailures"),
                      HealthThresholds.DEGRADED_FAILURES));
      case FAILING ->
          (root, query, cb) ->
              cb.greaterThanOrEqualTo(
                  root.get("health").get("consecutiveFailures"),
                  HealthThresholds.DEGRADED_FAILURES);
      case NODATA ->
          (root, query, cb) -> {
            Subquery<UUID> sessions = query.subquery(UUID.class);
            Root<CampSession> session = sessions.from(CampSession.class);
            sessions
                .select(session.get("sourceId"))
                .where(
                    cb.equal(session.get("sourceId"), root.get("id")),
                    cb.equal(session.get("status"), SessionStatus.ACTIVE));
            return cb.and(cb.isTrue(root.get("active")), cb.not(cb.exists(sessions)));
          };
    };
  }
}
