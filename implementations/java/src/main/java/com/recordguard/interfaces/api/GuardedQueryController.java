package com.recordguard.interfaces.api;

import com.recordguard.application.GuardedSessionService;
import com.recordguard.domain.model.GuardedSession;
import com.recordguard.domain.model.PipelineResult;
import com.recordguard.interfaces.api.dto.ErrorResponse;
import com.recordguard.interfaces.api.dto.HistoryResponse;
import com.recordguard.interfaces.api.dto.QueryResponse;
import com.recordguard.interfaces.api.dto.SessionResponse;
import com.recordguard.interfaces.api.dto.StartSessionRequest;
import com.recordguard.interfaces.api.dto.SubmitQueryRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST host for guarded sessions.
 *
 * <p>Every pipeline outcome, including denials and blocked queries, is a
 * 200 response; the outcome field tells them apart. Only unknown sessions,
 * unknown principals and malformed requests map to error statuses.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sessions", description = "Guarded natural-language access to the current user's record")
public class GuardedQueryController {

    private final GuardedSessionService sessionService;

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Start session",
        description = "Looks up the principal once and opens a session bound to it"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Session started",
            content = @Content(schema = @Schema(implementation = SessionResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Principal not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public SessionResponse startSession(@Valid @RequestBody(required = false) StartSessionRequest request) {
        Long principalId = request != null ? request.getPrincipalId() : null;
        GuardedSession session = sessionService.startSession(principalId);
        return SessionResponse.from(session);
    }

    @PostMapping(
        path = "/{sessionId}/queries",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Submit request",
        description = "Runs one natural-language request through authorization, query safety, execution and output sanitization"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Pipeline finished; see outcome",
            content = @Content(schema = @Schema(implementation = QueryResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Session not found or expired",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public QueryResponse submit(
            @Parameter(description = "Session ID", required = true) @PathVariable UUID sessionId,
            @Valid @RequestBody SubmitQueryRequest request) {
        PipelineResult result = sessionService.submit(sessionId, request.getRequest());
        return QueryResponse.from(result);
    }

    @GetMapping(path = "/{sessionId}/history", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Session history", description = "Answered requests and the responses released for them")
    public HistoryResponse history(@Parameter(description = "Session ID", required = true) @PathVariable UUID sessionId) {
        return HistoryResponse.from(sessionId, sessionService.history(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "End session")
    public void endSession(@Parameter(description = "Session ID", required = true) @PathVariable UUID sessionId) {
        sessionService.endSession(sessionId);
    }
}
