package com.parlayarchitect.audit;

/**
 * Write-only destination for audit records, implemented by the storage collaborator.
 *
 * <p>Called once per selection, after the result is final. Implementations must not block for
 * long; the default implementation is {@link InMemoryAuditSink}.
 */
public interface AuditSink {

    void write(AuditRecord auditRecord);
}
