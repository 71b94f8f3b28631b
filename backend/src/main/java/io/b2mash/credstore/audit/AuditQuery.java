package io.b2mash.credstore.audit;

import java.time.Instant;

/**
 * Filter for {@link AuditService#query}. All fields are nullable; null means "no filter on this
 * field". The tenant always comes from the caller context.
 *
 * @param from start of time range (inclusive)
 * @param to end of time range (exclusive)
 */
public record AuditQuery(
    AuditOperation operation,
    AuditOutcome outcome,
    String secretId,
    String actorId,
    Instant from,
    Instant to) {

  public static AuditQuery all() {
    return new AuditQuery(null, null, null, null, null, null);
  }

  /** Same filter with an upper bound, so that entries appended later fall outside it. */
  public AuditQuery endingAt(Instant end) {
    return new AuditQuery(operation, outcome, secretId, actorId, from, end);
  }
}
