package com.codeagent.engine.llm;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Per-call overrides; null fields fall back to the provider configuration. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatOptions {
    private Integer maxTokens;
    private Double temperature;
    private List<String> stop;
}
