package com.recordguard.infrastructure.oracle;

import com.recordguard.application.guardrail.StageInstructions;
import com.recordguard.application.guardrail.TextOracle;
import com.recordguard.domain.model.CapabilityLevel;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SessionState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OracleOpenAnswerResponderTest {

    @Mock
    private TextOracle oracle;

    @Test
    void foldsHistoryIntoTheUserMessage() {
        Principal principal = Principal.builder()
            .id(7)
            .identityString("john.doe@example.com")
            .displayName("John Doe")
            .capabilityLevel(CapabilityLevel.BASIC)
            .build();
        when(oracle.complete(anyString(), anyString())).thenReturn("Happy to help.");
        OracleOpenAnswerResponder responder = new OracleOpenAnswerResponder(oracle, new StageInstructions("users"));

        String answer = responder.answer(principal,
            List.of(new SessionState.Exchange("What's my name?", "John Doe")), "Thanks!");

        ArgumentCaptor<String> instruction = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> message = ArgumentCaptor.forClass(String.class);
        verify(oracle).complete(instruction.capture(), message.capture());
        assertEquals("Happy to help.", answer);
        assertEquals("User: What's my name?\nAssistant: John Doe\nUser: Thanks!", message.getValue());
        assertTrue(instruction.getValue().contains("John Doe"));
    }
}
