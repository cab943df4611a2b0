package com.recordguard.interfaces.console;

import com.recordguard.application.GuardedSessionService;
import com.recordguard.domain.model.GuardedSession;
import com.recordguard.domain.model.PipelineResult;
import com.recordguard.domain.model.PipelineState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.TreeSet;

/**
 * Interactive console host: logs in a random principal and answers lines
 * from standard input until {@code quit}.
 */
@Component
@ConditionalOnProperty(prefix = "recordguard.console", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class ConsoleSessionRunner implements CommandLineRunner {

    static final String QUIT = "quit";

    private final GuardedSessionService sessionService;

    @Override
    public void run(String... args) {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        converse(in, System.out);
    }

    void converse(BufferedReader in, PrintStream out) {
        GuardedSession session = sessionService.startSession(null);
        out.println("Welcome to the guarded assistant! Type '" + QUIT + "' to exit.");
        out.println("Logged in as: " + session.getPrincipal().getDisplayName()
            + " (" + session.getPrincipal().getIdentityString() + ")");
        out.println("You can ask questions about your own data in natural language.");
        out.println("Your user ID is: " + session.getPrincipal().getId());

        try {
            String line;
            while (true) {
                out.print("\nYou: ");
                out.flush();
                line = in.readLine();
                if (line == null || line.trim().equalsIgnoreCase(QUIT)) {
                    out.println("Goodbye!");
                    break;
                }
                if (line.isBlank()) {
                    continue;
                }
                print(sessionService.submit(session.getSessionId(), line.trim()), out);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Console input failed", e);
        } finally {
            sessionService.endSession(session.getSessionId());
        }
    }

    private static void print(PipelineResult result, PrintStream out) {
        out.println();
        out.println(result.getOutcome() == PipelineState.RESPONDED ? "AI: " + result.getMessage() : result.getMessage());
        if (result.getOutcome() == PipelineState.DENIED && !result.getSensitiveFields().isEmpty()) {
            out.println("Sensitive fields detected: " + String.join(", ", new TreeSet<>(result.getSensitiveFields())));
        }
        if (result.isSanitized()) {
            out.println("(Response was sanitized: " + result.getReason() + ")");
        }
    }
}
