package com.codeagent.engine.core;

import com.codeagent.engine.cancel.CancellationController;
import com.codeagent.engine.cancel.CancellationRegistration;
import com.codeagent.engine.compression.CompressionResult;
import com.codeagent.engine.compression.CompressionSummary;
import com.codeagent.engine.compression.ConversationManager;
import com.codeagent.engine.compression.SimpleTrimmer;
import com.codeagent.engine.exception.CompressionException;
import com.codeagent.engine.exception.TrajectoryException;
import com.codeagent.engine.llm.ChatOptions;
import com.codeagent.engine.llm.LlmClient;
import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.AgentExecution;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.TokenUsage;
import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.output.AgentEvent;
import com.codeagent.engine.output.ConfirmationDecision;
import com.codeagent.engine.output.ConfirmationKind;
import com.codeagent.engine.output.ConfirmationRequest;
import com.codeagent.engine.output.MessageLevel;
import com.codeagent.engine.output.SafeOutput;
import com.codeagent.engine.output.StepInfo;
import com.codeagent.engine.output.ToolExecutionInfo;
import com.codeagent.engine.state.PersistedAgentContext;
import com.codeagent.engine.tool.ToolCapability;
import com.codeagent.engine.tool.ToolExecutor;
import com.codeagent.engine.tool.ToolRegistry;
import com.codeagent.engine.tool.ToolResult;
import com.codeagent.engine.trajectory.TrajectoryEntry;
import com.codeagent.engine.trajectory.TrajectoryRecorder;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Step state machine of the coding agent.
 *
 * Per task:
 * 1. Create or update the execution context (the original goal survives across tasks)
 * 2. Seed the system prompt into an empty history, repair dangling tool uses, append the task
 * 3. Loop up to max_steps: check cancellation, compress, check again, then race one
 *    step (model call + tool dispatch) against the cancellation signal
 * 4. Emit exactly one terminal event: completed, or interrupted
 *
 * A step runs on the step executor. When cancellation wins the race the step is
 * abandoned: its remaining history writes, events and journal entries are dropped.
 * A tool that is already running may still finish.
 */
@Slf4j
public class AgentEngine implements Agent {

    public static final String AGENT_TYPE = "coding_agent";

    static final String SUCCESS_SUMMARY = "Task completed successfully";
    static final String INTERRUPTED_REASON = "Execution interrupted by user";
    static final String INTERRUPTED_RESULT = "Execution interrupted";
    static final String REPAIRED_TOOL_RESULT = "Previous task interrupted or incomplete";
    static final String CONFIRMATION_DENIED = "Execution cancelled by user";
    static final int FALLBACK_TRIM_MESSAGES = SimpleTrimmer.DEFAULT_MAX_MESSAGES;

    private static final String THOUGHT_PREFIX = "Thought: ";

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final SafeOutput output;
    private final ConversationManager conversationManager;
    private final Executor stepExecutor;

    private final Object historyLock = new Object();
    private final List<Message> history = new ArrayList<>();

    private volatile AgentConfig config;
    private volatile ToolExecutor toolExecutor;
    private volatile ExecutionContext executionContext;
    private volatile TrajectoryRecorder trajectoryRecorder;
    private volatile CancellationController cancellationController;
    private volatile CancellationRegistration cancellationRegistration;

    AgentEngine(AgentConfig config,
                LlmClient llmClient,
                ToolExecutor toolExecutor,
                ToolRegistry toolRegistry,
                SafeOutput output,
                ConversationManager conversationManager,
                TrajectoryRecorder trajectoryRecorder,
                Executor stepExecutor,
                CancellationController cancellationController) {
        this.config = config;
        this.llmClient = llmClient;
        this.toolExecutor = toolExecutor;
        this.toolRegistry = toolRegistry;
        this.output = output;
        this.conversationManager = conversationManager;
        this.trajectoryRecorder = trajectoryRecorder;
        this.stepExecutor = stepExecutor;
        setCancellationController(cancellationController);
    }

    public static AgentEngineBuilder builder() {
        return new AgentEngineBuilder();
    }

    // ─── Task execution ───────────────────────────────────────────────────────

    @Override
    public AgentExecution executeTask(String task) {
        return executeTaskWithContext(task, Paths.get("").toAbsolutePath());
    }

    @Override
    public AgentExecution executeTaskWithContext(String task, Path projectPath) {
        long startNanos = System.nanoTime();
        CancellationRegistration registration = this.cancellationRegistration;
        AgentConfig cfg = this.config;

        ExecutionContext ctx = beginContext(task, projectPath, cfg);
        log.info("Task started [agent={}, maxSteps={}, project={}]", ctx.getAgentId(), cfg.getMaxSteps(), projectPath);

        output.emit(new AgentEvent.ExecutionStarted(ctx.copy()));
        record(TrajectoryEntry.taskStart(task, cfg.copy()));

        synchronized (historyLock) {
            if (history.isEmpty()) {
                history.add(Message.system(buildSystemPrompt(projectPath)));
            }
            repairDanglingToolUses();
            history.add(Message.user(task));
        }

        int step = 0;
        boolean completed = false;
        boolean interrupted = false;

        while (step < cfg.getMaxSteps() && !completed) {
            if (registration.isCancelled()) {
                interrupted = true;
                break;
            }

            applyCompression(ctx);

            if (registration.isCancelled()) {
                interrupted = true;
                break;
            }

            step++;
            ctx.setCurrentStep(step);
            StepInfo stepInfo = new StepInfo(step, task);
            output.emit(new AgentEvent.StepStarted(stepInfo));
            log.debug("Step {}/{} [agent={}]", step, cfg.getMaxSteps(), ctx.getAgentId());

            StepScope scope = new StepScope(historyLock, step);
            CompletableFuture<Boolean> stepFuture;
            try {
                stepFuture = CompletableFuture.supplyAsync(() -> executeStep(scope, ctx, projectPath), stepExecutor);
            } catch (RejectedExecutionException e) {
                return fail(ctx, step, e, startNanos);
            }

            try {
                CompletableFuture.anyOf(registration.cancelled(), stepFuture).join();
            } catch (CompletionException e) {
                // step failed; inspected below
                log.trace("Step {} finished exceptionally", step);
            }

            if (!stepFuture.isDone() && registration.isCancelled()) {
                scope.abandon();
                log.info("Step {} abandoned on cancellation [agent={}]", step, ctx.getAgentId());
                interrupted = true;
                break;
            }

            try {
                completed = stepFuture.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                return fail(ctx, step, cause, startNanos);
            }

            record(TrajectoryEntry.stepComplete("Step " + step + " completed", true, step));
            output.emit(new AgentEvent.StepCompleted(stepInfo));
        }

        long durationMs = finish(ctx, step, startNanos);

        if (interrupted) {
            record(TrajectoryEntry.taskComplete(false, INTERRUPTED_RESULT, step, durationMs));
            output.emit(new AgentEvent.ExecutionInterrupted(ctx.copy(), INTERRUPTED_REASON));
            output.flush();
            log.warn("Task interrupted [agent={}, steps={}, duration={}ms]", ctx.getAgentId(), step, durationMs);
            return AgentExecution.interrupted(step, durationMs);
        }

        String summary = completed ? SUCCESS_SUMMARY : "Task incomplete after " + step + " steps";
        record(TrajectoryEntry.taskComplete(completed, summary, step, durationMs));
        output.emit(new AgentEvent.ExecutionCompleted(ctx.copy(), completed, summary));
        output.flush();

        log.info("Task finished [agent={}, success={}, steps={}, duration={}ms, tokens={}]",
                ctx.getAgentId(), completed, step, durationMs, ctx.getTokenUsage().getTotalTokens());
        return completed
                ? AgentExecution.success(summary, step, durationMs)
                : AgentExecution.failure(summary, step, durationMs);
    }

    private ExecutionContext beginContext(String task, Path projectPath, AgentConfig cfg) {
        ExecutionContext ctx = this.executionContext;
        if (ctx == null) {
            ctx = ExecutionContext.builder()
                    .agentId(AGENT_TYPE)
                    .originalGoal(task)
                    .currentTask(task)
                    .projectPath(projectPath.toString())
                    .maxSteps(cfg.getMaxSteps())
                    .currentStep(0)
                    .build();
            this.executionContext = ctx;
        } else {
            ctx.setCurrentTask(task);
            ctx.setCurrentStep(0);
            ctx.setProjectPath(projectPath.toString());
            ctx.setMaxSteps(cfg.getMaxSteps());
        }
        return ctx;
    }

    private AgentExecution fail(ExecutionContext ctx, int step, Throwable cause, long startNanos) {
        String message = "Error in step " + step + ": " + cause.getMessage();
        log.error("Task failed [agent={}, step={}]: {}", ctx.getAgentId(), step, cause.getMessage(), cause);

        record(TrajectoryEntry.error(cause.getMessage(), "Step " + step, step));
        long durationMs = finish(ctx, step, startNanos);
        output.emit(new AgentEvent.ExecutionCompleted(ctx.copy(), false, message));
        output.flush();
        return AgentExecution.failure(message, step, durationMs);
    }

    private long finish(ExecutionContext ctx, int step, long startNanos) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        synchronized (historyLock) {
            ctx.setCurrentStep(step);
            ctx.setExecutionTime(elapsed);
        }
        return elapsed.toMillis();
    }

    /**
     * Give every tool use of the most recent assistant message a result. Unanswered
     * ids get a synthetic error result. Caller holds the history lock.
     */
    private void repairDanglingToolUses() {
        int lastAssistant = -1;
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getRole() == Message.Role.assistant) {
                lastAssistant = i;
                break;
            }
        }
        if (lastAssistant < 0) return;

        Set<String> pending = new LinkedHashSet<>();
        history.get(lastAssistant).toolUses().forEach(tu -> pending.add(tu.getId()));
        for (int i = lastAssistant + 1; i < history.size(); i++) {
            history.get(i).toolResults().forEach(r -> pending.remove(r.getToolUseId()));
        }

        for (String id : pending) {
            history.add(Message.toolResult(id, true, REPAIRED_TOOL_RESULT));
        }
        if (!pending.isEmpty()) {
            log.warn("Added {} synthetic tool results for incomplete tool calls from previous task", pending.size());
        }
    }

    private void applyCompression(ExecutionContext ctx) {
        List<Message> current;
        synchronized (historyLock) {
            current = new ArrayList<>(history);
        }

        try {
            CompressionResult result = conversationManager.maybeCompress(current, ctx);
            if (!result.isCompressed()) return;

            replaceHistory(result.messages());
            CompressionSummary summary = result.compressionApplied();
            output.emit(new AgentEvent.CompressionStarted(
                    summary.getLevel().asStr(),
                    summary.getTokensBefore(),
                    summary.getTokensAfter(),
                    "Token usage requires " + summary.getLevel().asStr() + " compression"));
            output.emit(new AgentEvent.CompressionCompleted(
                    summary.getSummary(),
                    summary.getTokensSaved(),
                    summary.getMessagesBefore(),
                    summary.getMessagesAfter()));
            log.info("Compression completed: {}", summary.getSummary());
        } catch (CompressionException e) {
            log.warn("Compression failed: {}. Falling back to simple trimming.", e.getMessage());
            replaceHistory(SimpleTrimmer.trim(current, FALLBACK_TRIM_MESSAGES));
            output.emit(new AgentEvent.CompressionFailed(e.getMessage(), "Simple message trimming applied"));
        }
    }

    private void replaceHistory(List<Message> messages) {
        synchronized (historyLock) {
            history.clear();
            history.addAll(messages);
        }
    }

    // ─── Single step (runs on the step executor) ─────────────────────────────

    /** @return true if a completion-signal tool succeeded */
    private boolean executeStep(StepScope scope, ExecutionContext ctx, Path projectPath) {
        int step = scope.step();

        List<Message> outbound = new ArrayList<>();
        List<Message> snapshot = scope.read(() -> new ArrayList<>(history));
        if (snapshot.isEmpty() || snapshot.get(0).getRole() != Message.Role.system) {
            outbound.add(Message.system(buildSystemPrompt(projectPath)));
        }
        outbound.addAll(snapshot);

        recordIn(scope, TrajectoryEntry.llmRequest(outbound, llmClient.modelName(), llmClient.providerName(), step));

        ToolExecutor tools = this.toolExecutor;
        LlmResponse response;
        try {
            response = llmClient.chatCompletion(outbound, tools.getToolDefinitions(), new ChatOptions());
        } catch (RuntimeException e) {
            log.error("LLM request failed for step {}: {}", step, e.getMessage());
            emitIn(scope, new AgentEvent.Message(MessageLevel.ERROR, "LLM request failed: " + e.getMessage(), Map.of()));
            throw e;
        }

        if (response.getUsage() != null && scope.mutate(() -> ctx.getTokenUsage().add(response.getUsage()))) {
            TokenUsage total = scope.read(() -> ctx.getTokenUsage().copy());
            emitIn(scope, new AgentEvent.TokenUsageUpdated(total));
        }
        recordIn(scope, TrajectoryEntry.llmResponse(response, step));

        Message assistant = response.getMessage();
        scope.mutate(() -> history.add(assistant));

        if (assistant.hasToolUse()) {
            for (ContentBlock.ToolUse toolUse : assistant.toolUses()) {
                if (scope.isAbandoned()) return false;
                if (dispatchTool(scope, tools, toolUse, projectPath)) {
                    return true;
                }
            }
            return false;
        }

        assistant.textContent()
                .filter(text -> !text.isBlank())
                .ifPresent(text -> emitIn(scope, new AgentEvent.Message(MessageLevel.NORMAL, text, Map.of())));
        return false;
    }

    /** @return true if the tool signalled completion */
    private boolean dispatchTool(StepScope scope, ToolExecutor tools, ContentBlock.ToolUse toolUse, Path projectPath) {
        int step = scope.step();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(ToolCall.PROJECT_PATH_KEY, projectPath.toString());
        ToolCall call = ToolCall.from(toolUse);
        call.setMetadata(metadata);

        ToolExecutionInfo info = ToolExecutionInfo.started(call);
        emitIn(scope, new AgentEvent.ToolExecutionStarted(info));
        recordIn(scope, TrajectoryEntry.toolCall(call, step));

        ToolResult result = runTool(scope, tools, call);

        emitIn(scope, new AgentEvent.ToolExecutionCompleted(info.completed(result)));
        if (tools.hasCapability(call.getName(), ToolCapability.THOUGHT_STREAM)) {
            extractThought(result).ifPresent(thought ->
                    emitIn(scope, new AgentEvent.AgentThinking(step, thought)));
        }
        recordIn(scope, TrajectoryEntry.toolResult(result, step));

        Message resultMessage = Message.toolResult(call.getId(), !result.isSuccess(), result.getContent());
        scope.mutate(() -> history.add(resultMessage));

        return result.isSuccess() && tools.hasCapability(call.getName(), ToolCapability.COMPLETION_SIGNAL);
    }

    private ToolResult runTool(StepScope scope, ToolExecutor tools, ToolCall call) {
        if (tools.requiresConfirmation(call.getName())) {
            if (scope.isAbandoned()) {
                return ToolResult.error(call.getId(), CONFIRMATION_DENIED);
            }
            Map<String, Object> meta = new HashMap<>();
            meta.put("tool_name", call.getName());
            meta.put("parameters", call.getParameters());
            meta.put("tool_call_id", call.getId());
            ConfirmationRequest request = new ConfirmationRequest(
                    call.getId(),
                    ConfirmationKind.TOOL_EXECUTION,
                    "Execute tool: " + call.getName(),
                    "This tool requires confirmation before execution.",
                    meta);

            ConfirmationDecision decision = output.requestConfirmation(request);
            if (!decision.approved()) {
                log.info("Tool [{}] not approved: {}", call.getName(), decision.note());
                return ToolResult.error(call.getId(), CONFIRMATION_DENIED);
            }
        }

        try {
            return tools.execute(call);
        } catch (Exception e) {
            log.error("Tool execution failed for {}: {}", call.getName(), e.getMessage(), e);
            return ToolResult.error(call.getId(), "Tool execution failed: " + e.getMessage());
        }
    }

    static Optional<String> extractThought(ToolResult result) {
        if (result.getData() != null) {
            Object thought = result.getData().get("thought");
            return thought instanceof String s ? Optional.of(s) : Optional.empty();
        }
        String content = result.getContent();
        if (content == null) return Optional.empty();
        int start = content.indexOf(THOUGHT_PREFIX);
        if (start < 0) return Optional.empty();
        int from = start + THOUGHT_PREFIX.length();
        int end = content.indexOf("\n\n", from);
        return end < 0 ? Optional.empty() : Optional.of(content.substring(from, end));
    }

    private void emitIn(StepScope scope, AgentEvent event) {
        scope.publish(() -> output.emit(event));
    }

    private void recordIn(StepScope scope, TrajectoryEntry entry) {
        scope.publish(() -> record(entry));
    }

    private void record(TrajectoryEntry entry) {
        TrajectoryRecorder recorder = this.trajectoryRecorder;
        if (recorder == null) return;
        try {
            recorder.record(entry);
        } catch (TrajectoryException e) {
            log.warn("Failed to record trajectory entry [type={}, step={}]",
                    entry.getEntryType().getClass().getSimpleName(), entry.getStep(), e);
        }
    }

    // ─── System prompt ────────────────────────────────────────────────────────

    String buildSystemPrompt(Path projectPath) {
        return SystemPrompts.build(config.getSystemPrompt(), projectPath, toolExecutor.listTools());
    }

    /** Overrides the configured system prompt; null restores the default. */
    public void setSystemPrompt(String systemPrompt) {
        this.config = config.toBuilder().systemPrompt(systemPrompt).build();
    }

    public Optional<String> getConfiguredSystemPrompt() {
        return Optional.ofNullable(config.getSystemPrompt());
    }

    // ─── Cancellation ─────────────────────────────────────────────────────────

    /**
     * Swap the controller observed by subsequent tasks. The previous controller
     * keeps reaching whatever already subscribed to it.
     */
    public void setCancellationController(CancellationController controller) {
        this.cancellationRegistration = controller.subscribe();
        this.cancellationController = controller;
    }

    public void cancel() {
        cancellationController.cancel();
    }

    // ─── Snapshot ─────────────────────────────────────────────────────────────

    public PersistedAgentContext exportContextSnapshot() {
        synchronized (historyLock) {
            return PersistedAgentContext.builder()
                    .agentType(agentType())
                    .config(config.copy())
                    .conversationHistory(new ArrayList<>(history))
                    .executionContext(executionContext != null ? executionContext.copy() : null)
                    .build();
        }
    }

    public String exportContextJson() {
        return exportContextSnapshot().toJson();
    }

    public void exportContextToFile(Path path) {
        exportContextSnapshot().toFile(path);
    }

    /** Adopts the snapshot's config if present; always replaces history and execution context. */
    public void restoreContextFromSnapshot(PersistedAgentContext snapshot) {
        if (snapshot.getConfig() != null) {
            this.config = snapshot.getConfig().copy();
            if (toolRegistry != null) {
                this.toolExecutor = toolRegistry.createExecutor(config.getTools());
            }
        }
        synchronized (historyLock) {
            history.clear();
            history.addAll(snapshot.getConversationHistory());
            this.executionContext = snapshot.getExecutionContext() != null
                    ? snapshot.getExecutionContext().copy()
                    : null;
        }
        log.info("Restored agent context ({} messages)", snapshot.getConversationHistory().size());
    }

    public void restoreContextFromJson(String json) {
        restoreContextFromSnapshot(PersistedAgentContext.fromJson(json));
    }

    public void restoreContextFromFile(Path path) {
        restoreContextFromSnapshot(PersistedAgentContext.fromFile(path));
    }

    /** Replace history only; the execution context is cleared. */
    public void restoreFromHistory(List<Message> messages) {
        synchronized (historyLock) {
            history.clear();
            history.addAll(messages);
            this.executionContext = null;
        }
    }

    // ─── Accessors ────────────────────────────────────────────────────────────

    public List<Message> conversationHistory() {
        synchronized (historyLock) {
            return List.copyOf(history);
        }
    }

    public Optional<ExecutionContext> executionContext() {
        synchronized (historyLock) {
            return Optional.ofNullable(executionContext).map(ExecutionContext::copy);
        }
    }

    public ToolExecutor toolExecutor() {
        return toolExecutor;
    }

    @Override
    public AgentConfig config() {
        return config;
    }

    @Override
    public String agentType() {
        return AGENT_TYPE;
    }

    @Override
    public void setTrajectoryRecorder(TrajectoryRecorder recorder) {
        this.trajectoryRecorder = recorder;
    }

    @Override
    public Optional<TrajectoryRecorder> trajectoryRecorder() {
        return Optional.ofNullable(trajectoryRecorder);
    }
}
