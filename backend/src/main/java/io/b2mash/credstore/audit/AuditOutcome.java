package io.b2mash.credstore.audit;

public enum AuditOutcome {
  SUCCESS,
  FAILURE
}
