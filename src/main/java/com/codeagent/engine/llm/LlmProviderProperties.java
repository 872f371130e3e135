package com.codeagent.engine.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/**
 * Resolved configuration for the active model provider.
 * Bound from application.yml under the "llm" prefix.
 */
@Data
@ConfigurationProperties(prefix = "llm")
public class LlmProviderProperties {

    private Protocol protocol = Protocol.OPENAI_COMPAT;
    private String apiKey = "";
    private String baseUrl = "https://api.openai.com/v1";
    private String model = "gpt-4o";
    private int maxTokens = 8192;
    private double temperature = 0.5;

    /** Extra headers sent with every request */
    private Map<String, String> headers = new HashMap<>();

    private Retry retry = new Retry();

    @Data
    public static class Retry {
        /** 1 disables retrying */
        private int maxAttempts = 1;
        private long waitMs = 2000;
    }
}
