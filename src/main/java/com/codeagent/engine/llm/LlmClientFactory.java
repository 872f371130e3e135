package com.codeagent.engine.llm;

import com.codeagent.engine.exception.ConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds the model capability for a resolved provider configuration.
 *
 * Supported protocols: OPENAI_COMPAT, AZURE_OPENAI, ANTHROPIC. GOOGLE_AI and
 * CUSTOM have no client and are rejected.
 */
@Slf4j
public final class LlmClientFactory {

    private LlmClientFactory() {}

    public static LlmClient create(LlmProviderProperties props,
                                   ObjectMapper objectMapper,
                                   RestClient.Builder restClientBuilder) {
        LlmClient client = switch (props.getProtocol()) {
            case OPENAI_COMPAT -> new OpenAiCompatibleLlmClient(props, objectMapper, "openai", restClientBuilder.clone());
            case AZURE_OPENAI -> new OpenAiCompatibleLlmClient(props, objectMapper, "azure", restClientBuilder.clone());
            case ANTHROPIC -> new AnthropicLlmClient(props, restClientBuilder.clone());
            case GOOGLE_AI, CUSTOM -> throw new ConfigurationException(
                    "Unsupported provider protocol: " + props.getProtocol());
        };

        int maxAttempts = props.getRetry().getMaxAttempts();
        if (maxAttempts > 1) {
            log.info("LLM retry enabled [attempts={}, wait={}ms]", maxAttempts, props.getRetry().getWaitMs());
            return new RetryingLlmClient(client, maxAttempts, Duration.ofMillis(props.getRetry().getWaitMs()));
        }
        return client;
    }
}
