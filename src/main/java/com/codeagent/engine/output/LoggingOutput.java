package com.codeagent.engine.output;

import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;

/**
 * Sink that writes events to the application log. Used by the REST host, where
 * no user is attached to approve tool executions.
 */
@Slf4j
public class LoggingOutput implements AgentOutput {

    private final String sessionId;
    private final boolean autoApprove;

    public LoggingOutput(String sessionId, boolean autoApprove) {
        this.sessionId = sessionId;
        this.autoApprove = autoApprove;
    }

    @Override
    public void emitEvent(AgentEvent event) {
        if (event instanceof AgentEvent.ExecutionStarted e) {
            log.info("Task started [session={}]: {}", sessionId, e.context().getCurrentTask());
        } else if (event instanceof AgentEvent.ExecutionCompleted e) {
            ExecutionContext ctx = e.context();
            TokenUsage usage = ctx.getTokenUsage();
            log.info("Task {} [session={}, steps={}, duration={}ms, tokens={}]: {}",
                    e.success() ? "completed" : "failed", sessionId, ctx.getCurrentStep(),
                    ctx.getExecutionTime().toMillis(), usage.getTotalTokens(), e.summary());
        } else if (event instanceof AgentEvent.ExecutionInterrupted e) {
            log.warn("Task interrupted [session={}, steps={}]: {}",
                    sessionId, e.context().getCurrentStep(), e.reason());
        } else if (event instanceof AgentEvent.StepStarted e) {
            log.debug("Step {} started [session={}]", e.stepInfo().stepNumber(), sessionId);
        } else if (event instanceof AgentEvent.ToolExecutionCompleted e) {
            ToolExecutionInfo info = e.toolInfo();
            log.info("Tool [{}] {} [session={}, {}ms]",
                    info.getToolName(), info.getStatus(), sessionId, info.getExecutionTimeMs());
        } else if (event instanceof AgentEvent.AgentThinking e) {
            log.debug("Thinking [session={}, step={}]: {}", sessionId, e.stepNumber(), e.thinking());
        } else if (event instanceof AgentEvent.Message e) {
            switch (e.level()) {
                case DEBUG -> log.debug("[session={}] {}", sessionId, e.content());
                case WARNING -> log.warn("[session={}] {}", sessionId, e.content());
                case ERROR -> log.error("[session={}] {}", sessionId, e.content());
                default -> log.info("[session={}] {}", sessionId, e.content());
            }
        } else if (event instanceof AgentEvent.CompressionStarted e) {
            log.info("Starting {} compression [session={}]: {} -> {} tokens ({})",
                    e.level(), sessionId, e.currentTokens(), e.targetTokens(), e.reason());
        } else if (event instanceof AgentEvent.CompressionCompleted e) {
            log.info("Compression completed [session={}]: {} -> {} messages, saved {} tokens",
                    sessionId, e.messagesBefore(), e.messagesAfter(), e.tokensSaved());
        } else if (event instanceof AgentEvent.CompressionFailed e) {
            log.warn("Compression failed [session={}]: {}. Fallback: {}", sessionId, e.error(), e.fallbackAction());
        } else {
            log.trace("[session={}] {}", sessionId, event);
        }
    }

    @Override
    public ConfirmationDecision requestConfirmation(ConfirmationRequest request) {
        log.info("Confirmation {} [session={}]: {}",
                autoApprove ? "auto-approved" : "denied", sessionId, request.title());
        return autoApprove
                ? ConfirmationDecision.approve()
                : ConfirmationDecision.deny("Interactive confirmation is not available for this session");
    }
}
