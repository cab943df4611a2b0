package com.recordguard.infrastructure.audit;

/**
 * Records security-relevant pipeline outcomes. Implementations must not
 * touch the record store.
 */
public interface AuditService {
    void record(String category, String action, String sessionId, String principalId, String detail);
}
