package com.codeagent.engine.model;

public enum FinishReason {
    STOP, LENGTH, TOOL_CALLS, CONTENT_FILTER, OTHER;

    /** Maps OpenAI and Anthropic stop reasons onto one vocabulary. */
    public static FinishReason fromProvider(String raw) {
        if (raw == null) return null;
        return switch (raw) {
            case "stop", "end_turn", "stop_sequence" -> STOP;
            case "length", "max_tokens" -> LENGTH;
            case "tool_calls", "tool_use", "function_call" -> TOOL_CALLS;
            case "content_filter" -> CONTENT_FILTER;
            default -> OTHER;
        };
    }
}
