package com.llmrelay.relay_backend.config;

import com.llmrelay.relay_backend.model.domain.ProviderType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything the relay reads from the environment, bound once at startup.
 *
 * <pre>
 * relay:
 *   provider: mock            # openai | bedrock | mock
 *   temperature: 0.7
 *   max-tokens: 1000
 *   request-timeout: 120s
 *   dispatcher:
 *     responder-url: http://localhost:8080
 *     retry-attempts: 3
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    private String provider = "mock";
    private double temperature = 0.7;
    private int maxTokens = 1000;

    /** Single end-to-end bound applied to every outbound network call. */
    private Duration requestTimeout = Duration.ofSeconds(120);

    private OpenAi openai = new OpenAi();
    private Bedrock bedrock = new Bedrock();
    private Mock mock = new Mock();
    private Pricing pricing = new Pricing();
    private Dispatcher dispatcher = new Dispatcher();

    public ProviderType providerType() {
        return ProviderType.fromId(provider);
    }

    @Data
    public static class OpenAi {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String defaultModel = "gpt-4";
    }

    @Data
    public static class Bedrock {
        private String region = "us-east-1";
        private String defaultModel = "";
        /** Short name → full Bedrock model id. Empty unless configured. */
        private Map<String, String> modelAliases = new LinkedHashMap<>();
        // Only used to report whether credentials look configured; the SDK resolves the real ones.
        private String accessKeyId = "";
        private String profile = "";
        private String roleArn = "";

        public boolean hasCredentialHints() {
            return notBlank(accessKeyId) || notBlank(profile) || notBlank(roleArn);
        }
    }

    @Data
    public static class Mock {
        private Duration latency = Duration.ofMillis(100);
        private Duration wordDelay = Duration.ofMillis(50);
    }

    @Data
    public static class Pricing {
        /** Model id → {prompt, completion} USD per 1K tokens, merged over the built-in table. */
        private Map<String, Rate> rates = new LinkedHashMap<>();
        private Map<String, String> aliases = new LinkedHashMap<>();
    }

    @Data
    public static class Rate {
        private double prompt;
        private double completion;
    }

    @Data
    public static class Dispatcher {
        private String responderUrl = "http://localhost:8080";
        /** Total attempts per call, the first one included. */
        private int retryAttempts = 3;
        /** Attempt i waits 2^i of these before the next one. */
        private Duration backoffUnit = Duration.ofSeconds(1);
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
