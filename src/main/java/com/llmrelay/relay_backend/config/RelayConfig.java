package com.llmrelay.relay_backend.config;

import com.llmrelay.relay_backend.dispatch.Sleeper;
import com.llmrelay.relay_backend.service.ConversationLog;
import com.llmrelay.relay_backend.service.UsageAggregator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Shared state and infrastructure for both sides of the relay.
 * Each side owns its own usage totals; the conversation log belongs to the messenger.
 */
@Configuration
@EnableConfigurationProperties(RelayProperties.class)
public class RelayConfig {

    /** Runs blocking provider calls and stream producers off the request thread. */
    @Bean(name = "providerExecutor")
    public ThreadPoolTaskExecutor providerExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(16);
        ex.setQueueCapacity(64);
        ex.setThreadNamePrefix("provider-");
        ex.initialize();
        return ex;
    }

    @Bean(name = "responderUsage")
    public UsageAggregator responderUsage() {
        return new UsageAggregator();
    }

    @Bean(name = "messengerUsage")
    public UsageAggregator messengerUsage() {
        return new UsageAggregator();
    }

    @Bean
    public ConversationLog conversationLog() {
        return new ConversationLog();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    /** Client for messenger → responder calls, bounded by the one request timeout. */
    @Bean(name = "responderRestTemplate")
    public RestTemplate responderRestTemplate(RelayProperties props) {
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, props.getRequestTimeout().toMillis());
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(timeoutMs);
        f.setReadTimeout(timeoutMs);
        return new RestTemplate(f);
    }
}
