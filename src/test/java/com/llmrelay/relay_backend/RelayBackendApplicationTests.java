package com.llmrelay.relay_backend;

import com.llmrelay.relay_backend.dispatch.RequestDispatcher;
import com.llmrelay.relay_backend.provider.MockProvider;
import com.llmrelay.relay_backend.provider.ProviderRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "relay.provider=mock",
        "relay.mock.latency=0ms",
        "relay.dispatcher.responder-url=http://localhost:18080/"
})
class RelayBackendApplicationTests {

    @Autowired
    private ProviderRegistry registry;

    @Autowired
    private RequestDispatcher dispatcher;

    @Test
    void contextLoads_withMockProviderSelected() {
        assertThat(registry.get()).isInstanceOf(MockProvider.class);
        assertThat(dispatcher.getResponderUrl()).isEqualTo("http://localhost:18080");
    }
}
