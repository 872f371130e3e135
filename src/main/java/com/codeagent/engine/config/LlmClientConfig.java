package com.codeagent.engine.config;

import com.codeagent.engine.llm.LlmClient;
import com.codeagent.engine.llm.LlmClientFactory;
import com.codeagent.engine.llm.LlmProviderProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active LLM client from the "llm" properties.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class LlmClientConfig {

    private final LlmProviderProperties llmProperties;

    @PostConstruct
    public void logActiveProvider() {
        log.info("================================================================");
        log.info("  LLM Protocol : {}", llmProperties.getProtocol());
        log.info("  Base URL     : {}", llmProperties.getBaseUrl());
        log.info("  Model        : {}", llmProperties.getModel());
        logKey(llmProperties.getApiKey());
        log.info("================================================================");
    }

    @Bean
    public LlmClient llmClient(ObjectMapper objectMapper, RestClient.Builder restClientBuilder) {
        return LlmClientFactory.create(llmProperties, objectMapper, restClientBuilder);
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var: LLM_API_KEY={your-key}");
        } else {
            log.info("  Key          : {}...{}", key.substring(0, Math.min(8, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
