package com.recordguard.config;

import com.recordguard.application.PipelineMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code recordguard.*}.
 */
@Data
@ConfigurationProperties(prefix = "recordguard")
public class RecordGuardProperties {

    private Oracle oracle = new Oracle();
    private Store store = new Store();
    private Pipeline pipeline = new Pipeline();
    private Session session = new Session();
    private Console console = new Console();

    @Data
    public static class Oracle {
        /** OpenAI-compatible endpoint. */
        private String baseUrl = "https://openrouter.ai/api/v1";
        private String apiKey;
        private String modelName = "gpt-3.5-turbo";
        private double temperature = 0.0;
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Store {
        private String table = "users";
        private Duration queryTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Pipeline {
        private PipelineMode mode = PipelineMode.LAYERED;
        private boolean safetyVerificationEnabled = true;
        private boolean openAnswerEnabled = true;
    }

    @Data
    public static class Session {
        private long maximumSize = 10_000;
        private Duration idleTimeout = Duration.ofMinutes(30);
    }

    @Data
    public static class Console {
        private boolean enabled = false;
    }
}
