package com.recordguard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.EnableAspectJAutoProxy;

/**
 * Guarded natural-language access to a principal's own record.
 *
 * <p>Each request passes an authorization stage, a query safety stage backed
 * by a mechanical scope gate, read-only execution, and an output sanitization
 * stage. Hosts: the REST API under {@code /api/v1/sessions} and, with
 * {@code recordguard.console.enabled=true}, an interactive console.
 */
@SpringBootApplication
@EnableAspectJAutoProxy
@ConfigurationPropertiesScan
@Slf4j
public class RecordGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecordGuardApplication.class, args);
        log.info("Record guardrail service started");
    }
}
