package com.recordguard.config;

import com.recordguard.application.guardrail.QueryScopeGuard;
import com.recordguard.application.guardrail.StageInstructions;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Guardrail parts parameterized by the records table name.
 */
@Configuration
public class GuardrailConfiguration {

    @Bean
    public QueryScopeGuard queryScopeGuard(RecordGuardProperties properties) {
        return new QueryScopeGuard(properties.getStore().getTable());
    }

    @Bean
    public StageInstructions stageInstructions(RecordGuardProperties properties) {
        return new StageInstructions(properties.getStore().getTable());
    }
}
