package com.codeagent.engine.output;

import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.TokenUsage;

import java.util.Map;

/**
 * Everything the engine reports to its output sink.
 *
 * Per task: exactly one {@link ExecutionStarted}, then either exactly one
 * {@link ExecutionCompleted} or exactly one {@link ExecutionInterrupted}.
 */
public interface AgentEvent {

    record ExecutionStarted(ExecutionContext context) implements AgentEvent {}

    record ExecutionCompleted(ExecutionContext context, boolean success, String summary) implements AgentEvent {}

    record ExecutionInterrupted(ExecutionContext context, String reason) implements AgentEvent {}

    record StepStarted(StepInfo stepInfo) implements AgentEvent {}

    record StepCompleted(StepInfo stepInfo) implements AgentEvent {}

    record ToolExecutionStarted(ToolExecutionInfo toolInfo) implements AgentEvent {}

    record ToolExecutionUpdated(ToolExecutionInfo toolInfo) implements AgentEvent {}

    record ToolExecutionCompleted(ToolExecutionInfo toolInfo) implements AgentEvent {}

    record AgentThinking(int stepNumber, String thinking) implements AgentEvent {}

    record TokenUsageUpdated(TokenUsage tokenUsage) implements AgentEvent {}

    record StatusUpdate(String status, Map<String, Object> metadata) implements AgentEvent {}

    record Message(MessageLevel level, String content, Map<String, Object> metadata) implements AgentEvent {}

    record CompressionStarted(String level, long currentTokens, long targetTokens, String reason)
            implements AgentEvent {}

    record CompressionCompleted(String summary, long tokensSaved, int messagesBefore, int messagesAfter)
            implements AgentEvent {}

    record CompressionFailed(String error, String fallbackAction) implements AgentEvent {}
}
