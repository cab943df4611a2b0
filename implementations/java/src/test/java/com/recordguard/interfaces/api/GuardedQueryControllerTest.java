package com.recordguard.interfaces.api;

import com.recordguard.application.GuardedSessionService;
import com.recordguard.application.exceptions.PrincipalNotFoundException;
import com.recordguard.application.exceptions.SessionNotFoundException;
import com.recordguard.domain.model.CapabilityLevel;
import com.recordguard.domain.model.GuardedSession;
import com.recordguard.domain.model.PipelineResult;
import com.recordguard.domain.model.PipelineState;
import com.recordguard.domain.model.Principal;
import com.recordguard.domain.model.SessionState;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(GuardedQueryController.class)
class GuardedQueryControllerTest {

    private static final Principal PRINCIPAL = Principal.builder()
        .id(7)
        .identityString("john.doe@example.com")
        .displayName("John Doe")
        .capabilityLevel(CapabilityLevel.BASIC)
        .build();

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private GuardedSessionService sessionService;

    @Test
    void startsSessionForRequestedPrincipal() throws Exception {
        GuardedSession session = GuardedSession.start(PRINCIPAL);
        when(sessionService.startSession(7L)).thenReturn(session);

        mockMvc.perform(post("/api/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"principalId\": 7}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.sessionId").value(session.getSessionId().toString()))
            .andExpect(jsonPath("$.principalId").value(7))
            .andExpect(jsonPath("$.displayName").value("John Doe"));
    }

    @Test
    void startsSessionForAnyPrincipalWithoutBody() throws Exception {
        when(sessionService.startSession(null)).thenReturn(GuardedSession.start(PRINCIPAL));

        mockMvc.perform(post("/api/v1/sessions"))
            .andExpect(status().isCreated());

        verify(sessionService).startSession(null);
    }

    @Test
    void unknownPrincipalIsNotFound() throws Exception {
        when(sessionService.startSession(99L)).thenThrow(new PrincipalNotFoundException("Principal not found: 99"));

        mockMvc.perform(post("/api/v1/sessions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"principalId\": 99}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    void submitReturnsPipelineOutcome() throws Exception {
        UUID sessionId = UUID.randomUUID();
        PipelineResult result = PipelineResult.builder()
            .outcome(PipelineState.DENIED)
            .message("Access denied: Cannot access another user's data")
            .reason("Cannot access another user's data")
            .sensitiveField("phone_number")
            .transition(PipelineState.RECEIVED)
            .transition(PipelineState.AUTHORIZING)
            .transition(PipelineState.DENIED)
            .build();
        when(sessionService.submit(eq(sessionId), eq("What's Alice's phone number?"))).thenReturn(result);

        mockMvc.perform(post("/api/v1/sessions/{id}/queries", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": \"What's Alice's phone number?\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("DENIED"))
            .andExpect(jsonPath("$.message").value("Access denied: Cannot access another user's data"))
            .andExpect(jsonPath("$.sensitiveFields[0]").value("phone_number"))
            .andExpect(jsonPath("$.trail.length()").value(3));
    }

    @Test
    void blankRequestIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/sessions/{id}/queries", UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Validation Failed"))
            .andExpect(jsonPath("$.validationErrors[0].field").value("request"))
            .andExpect(jsonPath("$.validationErrors[0].constraint").value("NotBlank"))
            .andExpect(jsonPath("$.sessionId").doesNotExist());

        verifyNoInteractions(sessionService);
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(sessionService.submit(eq(sessionId), any())).thenThrow(new SessionNotFoundException(sessionId));

        mockMvc.perform(post("/api/v1/sessions/{id}/queries", sessionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"request\": \"What's my name?\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.sessionId").value(sessionId.toString()))
            .andExpect(jsonPath("$.path").value("/api/v1/sessions/" + sessionId + "/queries"));
    }

    @Test
    void historyListsAnsweredExchanges() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(sessionService.history(sessionId))
            .thenReturn(List.of(new SessionState.Exchange("What's my city?", "Springfield")));

        mockMvc.perform(get("/api/v1/sessions/{id}/history", sessionId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.exchanges[0].request").value("What's my city?"))
            .andExpect(jsonPath("$.exchanges[0].response").value("Springfield"));
    }

    @Test
    void endSessionReturnsNoContent() throws Exception {
        UUID sessionId = UUID.randomUUID();

        mockMvc.perform(delete("/api/v1/sessions/{id}", sessionId))
            .andExpect(status().isNoContent());

        verify(sessionService).endSession(sessionId);
    }

    @Test
    void endingUnknownSessionIsNotFound() throws Exception {
        UUID sessionId = UUID.randomUUID();
        doThrow(new SessionNotFoundException(sessionId)).when(sessionService).endSession(sessionId);

        mockMvc.perform(delete("/api/v1/sessions/{id}", sessionId))
            .andExpect(status().isNotFound());
    }

    @Test
    void unexpectedFailureIsGenericServerError() throws Exception {
        UUID sessionId = UUID.randomUUID();
        when(sessionService.history(sessionId)).thenThrow(new IllegalStateException("secret detail"));

        mockMvc.perform(get("/api/v1/sessions/{id}/history", sessionId))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred. Please try again later."))
            .andExpect(jsonPath("$.errorId").isNotEmpty())
            .andExpect(jsonPath("$.validationErrors").doesNotExist());
    }
}
