package com.recordguard.infrastructure.oracle;

import com.recordguard.application.exceptions.OracleUnavailableException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainTextOracleTest {

    @Mock
    private ChatModel chatModel;

    private LangChainTextOracle oracle;

    @BeforeEach
    void setUp() {
        oracle = new LangChainTextOracle(chatModel);
    }

    @Test
    void returnsCompletionText() {
        when(chatModel.chat(any(SystemMessage.class), any(UserMessage.class)))
            .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("safe: true")).build());

        assertEquals("safe: true", oracle.complete("instruction", "SQL Query to verify: SELECT 1"));
        verify(chatModel).chat(SystemMessage.from("instruction"), UserMessage.from("SQL Query to verify: SELECT 1"));
    }

    @Test
    void missingResponseIsEmptyText() {
        when(chatModel.chat(any(SystemMessage.class), any(UserMessage.class))).thenReturn(null);

        assertEquals("", oracle.complete("instruction", "Query: hi"));
    }

    @Test
    void modelFailureBecomesOracleUnavailable() {
        when(chatModel.chat(any(SystemMessage.class), any(UserMessage.class)))
            .thenThrow(new RuntimeException("read timed out"));

        OracleUnavailableException e = assertThrows(OracleUnavailableException.class,
            () -> oracle.complete("instruction", "Query: hi"));
        assertEquals("text-oracle", e.collaborator());
    }
}
