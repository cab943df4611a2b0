package com.recordguard.infrastructure.audit;

import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class LoggingAuditService implements AuditService {

    @Override
    public void record(String category, String action, String sessionId, String principalId, String detail) {
        log.info("AUDIT category={} action={} session={} principal={} detail={}",
                category, action, sessionId, principalId, detail == null ? null : Encode.forJava(detail));
    }
}
