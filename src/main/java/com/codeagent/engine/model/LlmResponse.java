package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LlmResponse {

    /** Assistant message; tool requests arrive as tool_use blocks */
    private Message message;

    /** Null when the provider did not report usage */
    private Usage usage;

    private String model;

    private FinishReason finishReason;
}
