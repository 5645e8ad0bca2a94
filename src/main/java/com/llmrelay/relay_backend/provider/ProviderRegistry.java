package com.llmrelay.relay_backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.error.ConfigurationException;
import com.llmrelay.relay_backend.model.domain.ProviderType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrock.BedrockClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeAsyncClient;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Owns the one active {@link CompletionProvider} for the life of the process.
 *
 * <p>The variant is chosen from {@code relay.provider} and built on the first {@link #get()};
 * every later call returns the same instance. A construction failure is rethrown and the next
 * call tries again. Switching providers needs a restart.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final RelayProperties props;
    private final ObjectMapper mapper;
    private final Executor worker;
    private final ProviderType type;

    private volatile CompletionProvider active;

    public ProviderRegistry(RelayProperties props, ObjectMapper mapper,
                            @Qualifier("providerExecutor") Executor worker) {
        this.props = props;
        this.mapper = mapper;
        this.worker = worker;
        this.type = props.providerType();
    }

    public CompletionProvider get() {
        CompletionProvider p = active;
        if (p != null) return p;
        synchronized (this) {
            if (active == null) {
                active = create(type);
                log.info("Completion provider ready: {} (default model '{}')", type.getId(), active.getDefaultModel());
            }
            return active;
        }
    }

    public ProviderType getType() {
        return type;
    }

    /** Whether the credentials this provider needs appear to be present, without building it. */
    public boolean isConfigured() {
        return switch (type) {
            case MOCK -> true;
            case OPENAI -> props.getOpenai().getApiKey() != null && !props.getOpenai().getApiKey().isBlank();
            case BEDROCK -> props.getBedrock().hasCredentialHints();
        };
    }

    /** The default model from configuration; used where building the provider must not be forced. */
    public String configuredDefaultModel() {
        return switch (type) {
            case MOCK -> MockProvider.MODEL;
            case OPENAI -> props.getOpenai().getDefaultModel();
            case BEDROCK -> props.getBedrock().getDefaultModel();
        };
    }

    protected CompletionProvider create(ProviderType type) {
        Duration timeout = props.getRequestTimeout();
        return switch (type) {
            case MOCK -> new MockProvider(worker, props.getMock().getLatency(), props.getMock().getWordDelay());
            case OPENAI -> new OpenAiCompatibleProvider(
                    props.getOpenai().getApiKey(),
                    props.getOpenai().getBaseUrl(),
                    props.getOpenai().getDefaultModel(),
                    timeout, mapper, worker);
            case BEDROCK -> createBedrock(timeout);
        };
    }

    private CompletionProvider createBedrock(Duration timeout) {
        RelayProperties.Bedrock cfg = props.getBedrock();
        if (cfg.getRegion() == null || cfg.getRegion().isBlank()) {
            throw new ConfigurationException("AWS region is not set. Configure relay.bedrock.region or AWS_REGION.");
        }
        Region region = Region.of(cfg.getRegion().trim());
        ClientOverrideConfiguration overrides = ClientOverrideConfiguration.builder()
                .apiCallTimeout(timeout)
                .build();
        return new BedrockAnthropicProvider(
                BedrockRuntimeClient.builder().region(region).overrideConfiguration(overrides).build(),
                BedrockRuntimeAsyncClient.builder().region(region).overrideConfiguration(overrides).build(),
                BedrockClient.builder().region(region).overrideConfiguration(overrides).build(),
                cfg.getDefaultModel(),
                cfg.getModelAliases(),
                timeout, mapper, worker);
    }
}
