package com.llmrelay.relay_backend.config;

import com.llmrelay.relay_backend.provider.ProviderRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Logs at startup which completion provider was selected and whether its credentials look present.
 * The provider itself is still built lazily on first use.
 */
@Slf4j
@Component
public class ProviderStartupLogger implements ApplicationRunner {

    private final ProviderRegistry registry;
    private final RelayProperties props;

    public ProviderStartupLogger(ProviderRegistry registry, RelayProperties props) {
        this.registry = registry;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        String model = registry.configuredDefaultModel();
        if (registry.isConfigured()) {
            log.info("[RELAY] Provider: {} ({}), default model '{}', temperature {}, max tokens {}",
                    registry.getType().getId(), registry.getType().getDisplayName(),
                    model == null || model.isBlank() ? "<unset>" : model,
                    props.getTemperature(), props.getMaxTokens());
        } else {
            log.warn("[RELAY] Provider {} selected but its credentials are not configured; completions will fail until they are",
                    registry.getType().getId());
        }
        log.info("[RELAY] Messenger forwards to {} with {} attempt(s)",
                props.getDispatcher().getResponderUrl(), props.getDispatcher().getRetryAttempts());
    }
}
