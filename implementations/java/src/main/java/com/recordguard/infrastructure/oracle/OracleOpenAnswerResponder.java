package com.recordguard.infrastructure.oracle;

import com.recordguard.application.OpenAnswerResponder;
import com.recordguard.application.guardrail.StageInstructions;
import com.recordguard.application.guardrail.TextOracle;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SessionState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Answers requests that need no record lookup through the text oracle,
 * with earlier exchanges of the session as context.
 */
@Component
@RequiredArgsConstructor
public class OracleOpenAnswerResponder implements OpenAnswerResponder {

    private final TextOracle oracle;
    private final StageInstructions instructions;

    @Override
    public String answer(Principal principal, List<SessionState.Exchange> history, String request) {
        StringBuilder message = new StringBuilder();
        for (SessionState.Exchange exchange : history) {
            message.append("User: ").append(exchange.request()).append('\n')
                .append("Assistant: ").append(exchange.response()).append('\n');
        }
        message.append("User: ").append(request);
        return oracle.complete(instructions.openAnswer(principal), message.toString());
    }
}
