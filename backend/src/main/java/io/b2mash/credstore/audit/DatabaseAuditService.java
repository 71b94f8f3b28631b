package io.b2mash.credstore.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.credstore.exception.ForbiddenException;
import io.b2mash.credstore.security.CallerContext;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code record()} runs in REQUIRES_NEW. A failed operation rolls back
 * its own changes, but the entry describing the failure must still be written.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private static final int EXPORT_PAGE_SIZE = 500;

  private final AuditLogRepository repository;
  private final ObjectMapper objectMapper;

  public DatabaseAuditService(AuditLogRepository repository, ObjectMapper objectMapper) {
    this.repository = repository;
    this.objectMapper = objectMapper;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void record(AuditEntryRecord record) {
    repository.save(new AuditLogEntry(record));
    log.debug(
        "Recorded audit entry: op={}, tenant={}, secret={}, outcome={}, error={}",
        record.operation(),
        record.tenantId(),
        record.secretId(),
        record.outcome(),
        record.errorCode());
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditLogEntry> query(CallerContext ctx, AuditQuery filter, Pageable pageable) {
    return repository.findByFilter(
        requireTenant(ctx),
        filter.operation(),
        filter.outcome(),
        filter.secretId(),
        filter.actorId(),
        filter.from(),
        filter.to(),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public long export(CallerContext ctx, AuditQuery filter, Writer out) {
    UUID tenantId = requireTenant(ctx);
    // Pages are newest first; entries recorded mid-export would shift the offsets.
    var bounded = filter.to() != null ? filter : filter.endingAt(Instant.now());
    long written = 0;
    Pageable pageable = PageRequest.of(0, EXPORT_PAGE_SIZE);
    Page<AuditLogEntry> page;
    try {
      do {
        page = query(ctx, bounded, pageable);
        for (var entry : page) {
          out.write(objectMapper.writeValueAsString(AuditEntryView.from(entry)));
          out.write('\n');
          written++;
        }
        pageable = page.nextPageable();
      } while (page.hasNext());
      out.flush();
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Audit entry could not be serialized", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Audit export for tenant " + tenantId + " failed", e);
    }
    log.info("Exported {} audit entries for tenant {}", written, tenantId);
    return written;
  }

  private static UUID requireTenant(CallerContext ctx) {
    if (!ctx.hasTenant()) {
      throw new ForbiddenException("Audit access requires a tenant scope");
    }
    return ctx.tenantId();
  }
}
