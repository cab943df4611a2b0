package com.recordguard.infrastructure.oracle;

import com.recordguard.application.exceptions.OracleUnavailableException;
import com.recordguard.application.guardrail.TextOracle;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextOracle} backed by a langchain4j chat model.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChainTextOracle implements TextOracle {

    private final ChatModel chatModel;

    @Override
    public String complete(String systemInstruction, String userMessage) {
        ChatResponse response;
        try {
            response = chatModel.chat(SystemMessage.from(systemInstruction), UserMessage.from(userMessage));
        } catch (RuntimeException e) {
            log.warn("Text oracle call failed: {}", e.getMessage());
            throw new OracleUnavailableException("Text oracle call failed", e);
        }
        AiMessage message = response == null ? null : response.aiMessage();
        if (message == null || message.text() == null) {
            log.debug("Text oracle returned no text");
            return "";
        }
        return message.text();
    }
}
