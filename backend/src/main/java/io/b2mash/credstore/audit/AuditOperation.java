package io.b2mash.credstore.audit;

/** Operation kinds recorded in the audit log. */
public enum AuditOperation {
  UPSERT_SECRET,
  GET_SECRET_MATERIAL,
  DELETE_SECRET,
  LIST_SECRETS,
  LIST_VERSIONS,
  GET_VERSION,
  ROLLBACK_SECRET,
  QUOTA_STATUS,
  QUOTA_PROVISION,
  QUOTA_OVERRIDE,
  SECRET_TYPE_REGISTER,
  SECRET_TYPE_UPDATE,
  AUDIT_QUERY,
  AUDIT_EXPORT,
  AUDIT_RETENTION_SWEEP,
  KEK_ROTATE,
  KEK_REWRAP,
  KEK_REVOKE,
  KEK_LIST
}
