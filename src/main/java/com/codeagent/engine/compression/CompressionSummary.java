package com.codeagent.engine.compression;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompressionSummary {
    private CompressionLevel level;
    private long tokensBefore;
    private long tokensAfter;
    private long tokensSaved;
    private int messagesBefore;
    private int messagesAfter;
    private String summary;
}
