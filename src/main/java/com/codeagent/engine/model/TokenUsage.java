package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Running token counters for an execution context. Only ever grows within a run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    private long inputTokens;
    private long outputTokens;
    private long totalTokens;

    public void add(Usage usage) {
        this.inputTokens += Math.max(0, usage.getPromptTokens());
        this.outputTokens += Math.max(0, usage.getCompletionTokens());
        this.totalTokens += Math.max(0, usage.getTotalTokens());
    }

    public TokenUsage copy() {
        return new TokenUsage(inputTokens, outputTokens, totalTokens);
    }
}
