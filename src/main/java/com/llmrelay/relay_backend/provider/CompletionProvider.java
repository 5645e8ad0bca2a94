package com.llmrelay.relay_backend.provider;

import com.llmrelay.relay_backend.model.domain.ProviderType;
import com.llmrelay.relay_backend.model.llm.CompletionRequest;
import com.llmrelay.relay_backend.model.llm.CompletionResult;
import com.llmrelay.relay_backend.model.llm.ProviderHealth;

import java.util.List;

/**
 * Uniform surface over every completion backend.
 *
 * <p>Implementations validate their credentials once, in the constructor, and throw
 * {@link com.llmrelay.relay_backend.error.ConfigurationException} there rather than per call.
 * Call-time failures surface as {@link com.llmrelay.relay_backend.error.ProviderException}.
 */
public interface CompletionProvider {

    ProviderType getType();

    CompletionResult complete(CompletionRequest request);

    /** Lazily produced chunks; the returned stream must be closed by the consumer. */
    ChunkStream completeStreaming(CompletionRequest request);

    /** Never throws; failures are reported as an unhealthy result. */
    ProviderHealth healthCheck();

    String getDefaultModel();

    /** Models this backend is known to serve, in display order. */
    List<String> listModels();

    /** Free-text remark shown next to the model listing, if any. */
    default String getNote() {
        return null;
    }
}
