package com.codeagent.engine.compression;

public record ConversationTokenStats(long estimatedTokens,
                                     long tokenBudget,
                                     double utilization,
                                     int messageCount,
                                     boolean compressionRecommended) {
}
