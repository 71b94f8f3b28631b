package io.b2mash.credstore.audit;

import io.b2mash.credstore.security.CallerContext;
import java.io.Writer;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/**
 * Records and reads audit entries. Recording is append-only; reads are always scoped to the
 * caller's tenant.
 */
public interface AuditService {

  /**
   * Appends one entry in its own transaction, so it survives a rollback of the audited operation.
   */
  void record(AuditEntryRecord record);

  /**
   * Queries the caller tenant's entries.
   *
   * @throws io.b2mash.credstore.exception.ForbiddenException for a caller without tenant
   */
  Page<AuditLogEntry> query(CallerContext ctx, AuditQuery filter, Pageable pageable);

  /**
   * Writes the caller tenant's matching entries to {@code out} as JSON lines, newest first.
   *
   * @return number of entries written
   */
  long export(CallerContext ctx, AuditQuery filter, Writer out);
}
