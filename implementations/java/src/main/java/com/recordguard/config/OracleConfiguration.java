package com.recordguard.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chat model behind the text oracle: any OpenAI-compatible endpoint.
 */
@Configuration
@Slf4j
public class OracleConfiguration {

    @Bean
    @ConditionalOnMissingBean(ChatModel.class)
    public ChatModel chatModel(RecordGuardProperties properties) {
        RecordGuardProperties.Oracle oracle = properties.getOracle();
        if (oracle.getApiKey() == null || oracle.getApiKey().isBlank()) {
            log.warn("No oracle API key configured (recordguard.oracle.api-key); every oracle call will fail");
        }
        log.info("Configuring text oracle: baseUrl={}, model={}, timeout={}",
            oracle.getBaseUrl(), oracle.getModelName(), oracle.getTimeout());
        return OpenAiChatModel.builder()
            .baseUrl(oracle.getBaseUrl())
            .apiKey(oracle.getApiKey())
            .modelName(oracle.getModelName())
            .temperature(oracle.getTemperature())
            .timeout(oracle.getTimeout())
            .build();
    }
}
