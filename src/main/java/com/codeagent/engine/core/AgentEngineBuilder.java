package com.codeagent.engine.core;

import com.codeagent.engine.cancel.CancellationController;
import com.codeagent.engine.compression.ConversationManager;
import com.codeagent.engine.exception.ConfigurationException;
import com.codeagent.engine.llm.LlmClient;
import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.output.AgentOutput;
import com.codeagent.engine.output.NullOutput;
import com.codeagent.engine.output.SafeOutput;
import com.codeagent.engine.tool.ToolExecutor;
import com.codeagent.engine.tool.ToolRegistry;
import com.codeagent.engine.trajectory.TrajectoryRecorder;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Assembles an {@link AgentEngine}. Only the LLM client is mandatory.
 *
 * Tools come either from an explicit {@link ToolExecutor} or from a
 * {@link ToolRegistry} filtered by {@link AgentConfig#getTools()}. With a
 * registry, restoring a snapshot that carries a different tool list rebuilds
 * the executor.
 */
public class AgentEngineBuilder {

    private static final ExecutorService SHARED_STEP_EXECUTOR = Executors.newCachedThreadPool(daemonThreads());

    private AgentConfig config = new AgentConfig();
    private LlmClient llmClient;
    private ToolExecutor toolExecutor;
    private ToolRegistry toolRegistry;
    private AgentOutput output = new NullOutput();
    private ConversationManager conversationManager;
    private TrajectoryRecorder trajectoryRecorder;
    private Executor stepExecutor = SHARED_STEP_EXECUTOR;
    private CancellationController cancellationController;

    AgentEngineBuilder() {
    }

    public AgentEngineBuilder config(AgentConfig config) {
        this.config = config;
        return this;
    }

    public AgentEngineBuilder llmClient(LlmClient llmClient) {
        this.llmClient = llmClient;
        return this;
    }

    public AgentEngineBuilder toolExecutor(ToolExecutor toolExecutor) {
        this.toolExecutor = toolExecutor;
        return this;
    }

    public AgentEngineBuilder toolRegistry(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
        return this;
    }

    public AgentEngineBuilder output(AgentOutput output) {
        this.output = output;
        return this;
    }

    public AgentEngineBuilder conversationManager(ConversationManager conversationManager) {
        this.conversationManager = conversationManager;
        return this;
    }

    public AgentEngineBuilder trajectoryRecorder(TrajectoryRecorder trajectoryRecorder) {
        this.trajectoryRecorder = trajectoryRecorder;
        return this;
    }

    public AgentEngineBuilder stepExecutor(Executor stepExecutor) {
        this.stepExecutor = stepExecutor;
        return this;
    }

    public AgentEngineBuilder cancellationController(CancellationController cancellationController) {
        this.cancellationController = cancellationController;
        return this;
    }

    /**
     * @throws ConfigurationException if no LLM client is set or max_steps is not positive
     */
    public AgentEngine build() {
        if (llmClient == null) {
            throw new ConfigurationException("An LLM client is required");
        }
        if (config == null) {
            throw new ConfigurationException("Agent config must not be null");
        }
        if (config.getMaxSteps() <= 0) {
            throw new ConfigurationException("max_steps must be positive, got " + config.getMaxSteps());
        }

        ToolExecutor tools = toolExecutor;
        if (tools == null) {
            tools = toolRegistry != null ? toolRegistry.createExecutor(config.getTools()) : ToolExecutor.of();
        }

        return new AgentEngine(
                config.copy(),
                llmClient,
                tools,
                toolRegistry,
                new SafeOutput(output != null ? output : new NullOutput()),
                conversationManager != null ? conversationManager : ConversationManager.withDefaults(128_000),
                trajectoryRecorder,
                stepExecutor,
                cancellationController != null ? cancellationController : CancellationController.create());
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "agent-step-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
