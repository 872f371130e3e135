package com.codeagent.engine.llm;

import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.tool.ToolDefinition;

import java.util.List;

/**
 * Model capability consumed by the engine. Vendor wire formats stay behind this interface.
 */
public interface LlmClient {

    /**
     * Send the conversation and available tool schemas to the model.
     *
     * @param messages full conversation so far (system + user + assistant + tool results)
     * @param tools    tool definitions the model may invoke; empty for none
     * @param options  per-call overrides, may be null
     * @return the assistant message plus usage and finish reason
     * @throws com.codeagent.engine.exception.LlmException on authentication, transport or remote failure
     */
    LlmResponse chatCompletion(List<Message> messages, List<ToolDefinition> tools, ChatOptions options);

    String modelName();

    String providerName();
}
