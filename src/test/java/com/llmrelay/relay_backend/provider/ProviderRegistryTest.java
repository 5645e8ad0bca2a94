package com.llmrelay.relay_backend.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.llmrelay.relay_backend.config.RelayProperties;
import com.llmrelay.relay_backend.error.ConfigurationException;
import com.llmrelay.relay_backend.model.domain.ProviderType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderRegistryTest {

    private final Executor direct = Runnable::run;

    private static RelayProperties props(String provider) {
        RelayProperties props = new RelayProperties();
        props.setProvider(provider);
        props.getMock().setLatency(Duration.ZERO);
        props.getMock().setWordDelay(Duration.ZERO);
        return props;
    }

    @Test
    void get_returnsTheSameInstanceEveryTime() {
        ProviderRegistry registry = new ProviderRegistry(props("mock"), new ObjectMapper(), direct);

        CompletionProvider first = registry.get();

        assertThat(first).isInstanceOf(MockProvider.class);
        assertThat(registry.get()).isSameAs(first);
        assertThat(registry.getType()).isEqualTo(ProviderType.MOCK);
        assertThat(registry.isConfigured()).isTrue();
        assertThat(registry.configuredDefaultModel()).isEqualTo("mock-model");
    }

    @Test
    void get_openAiWithoutKey_failsWithConfigurationError() {
        ProviderRegistry registry = new ProviderRegistry(props("openai"), new ObjectMapper(), direct);

        assertThat(registry.isConfigured()).isFalse();
        assertThatThrownBy(registry::get).isInstanceOf(ConfigurationException.class);
        // not cached; a second call retries construction and fails the same way
        assertThatThrownBy(registry::get).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void get_openAiWithKey_buildsOpenAiProvider() {
        RelayProperties props = props("OpenAI");
        props.getOpenai().setApiKey("sk-test");
        props.getOpenai().setDefaultModel("gpt-4o-mini");
        ProviderRegistry registry = new ProviderRegistry(props, new ObjectMapper(), direct);

        CompletionProvider provider = registry.get();

        assertThat(provider).isInstanceOf(OpenAiCompatibleProvider.class);
        assertThat(provider.getDefaultModel()).isEqualTo("gpt-4o-mini");
        assertThat(registry.isConfigured()).isTrue();
    }

    @Test
    void unknownProviderName_fallsBackToOpenAi() {
        ProviderRegistry registry = new ProviderRegistry(props("something-else"), new ObjectMapper(), direct);

        assertThat(registry.getType()).isEqualTo(ProviderType.OPENAI);
    }

    @Test
    void bedrock_withoutRegion_failsWithConfigurationError() {
        RelayProperties props = props("bedrock");
        props.getBedrock().setRegion(" ");
        ProviderRegistry registry = new ProviderRegistry(props, new ObjectMapper(), direct);

        assertThat(registry.isConfigured()).isFalse();
        assertThatThrownBy(registry::get).isInstanceOf(ConfigurationException.class);
    }

    @Test
    void bedrock_credentialHints_reportConfigured() {
        RelayProperties props = props("bedrock");
        props.getBedrock().setProfile("dev");
        props.getBedrock().setDefaultModel("claude-3-haiku");

        ProviderRegistry registry = new ProviderRegistry(props, new ObjectMapper(), direct);

        assertThat(registry.isConfigured()).isTrue();
        assertThat(registry.configuredDefaultModel()).isEqualTo("claude-3-haiku");
    }
}
