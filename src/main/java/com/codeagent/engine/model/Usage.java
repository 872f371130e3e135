package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Token usage reported by the provider for a single completion. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Usage {
    private int promptTokens;
    private int completionTokens;
    private int totalTokens;

    public static Usage of(int prompt, int completion) {
        return new Usage(prompt, completion, prompt + completion);
    }
}
