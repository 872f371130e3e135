package com.codeagent.engine.service;

import com.codeagent.engine.cancel.CancellationController;
import com.codeagent.engine.compression.ConversationManager;
import com.codeagent.engine.compression.DigestSummarizer;
import com.codeagent.engine.compression.LlmSummarizer;
import com.codeagent.engine.compression.Summarizer;
import com.codeagent.engine.compression.TokenCalculator;
import com.codeagent.engine.config.AgentProperties;
import com.codeagent.engine.core.AgentEngine;
import com.codeagent.engine.exception.SessionBusyException;
import com.codeagent.engine.exception.SessionNotFoundException;
import com.codeagent.engine.llm.LlmClient;
import com.codeagent.engine.model.AgentExecution;
import com.codeagent.engine.output.LoggingOutput;
import com.codeagent.engine.state.PersistedAgentContext;
import com.codeagent.engine.tool.ToolRegistry;
import com.codeagent.engine.trajectory.Trajectory;
import com.codeagent.engine.trajectory.TrajectoryRecorder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns one {@link AgentEngine} per session.
 *
 * Tasks and restores on a session are serialised by the session lock; a second
 * request while a task runs is rejected instead of queued. Each task gets a
 * fresh cancellation controller. Cancelling an idle session is a no-op.
 * Snapshot export does not take the lock.
 */
@Service
@Slf4j
public class AgentSessionService {

    private final LlmClient llmClient;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;
    private final Executor stepExecutor;

    private final Map<String, SessionHolder> sessions = new ConcurrentHashMap<>();

    public AgentSessionService(LlmClient llmClient,
                               ToolRegistry toolRegistry,
                               AgentProperties properties,
                               @Qualifier("agentStepExecutor") Executor stepExecutor) {
        this.llmClient = llmClient;
        this.toolRegistry = toolRegistry;
        this.properties = properties;
        this.stepExecutor = stepExecutor;
    }

    /**
     * Run a task in the session, creating the session on first use. Blocks until
     * the task reaches a terminal state.
     *
     * @throws SessionBusyException if the session is already running a task
     */
    public AgentExecution runTask(String sessionId, String task, String projectPath) {
        SessionHolder holder = sessions.computeIfAbsent(sessionId, this::newSession);
        Path path = Paths.get(projectPath != null && !projectPath.isBlank()
                ? projectPath
                : properties.getProjectPath()).toAbsolutePath().normalize();

        holder.begin(sessionId);
        try {
            log.info("Running task [session={}, project={}]", sessionId, path);
            return holder.engine().executeTaskWithContext(task, path);
        } finally {
            holder.end();
        }
    }

    /** @return true if a running task was signalled */
    public boolean cancel(String sessionId) {
        boolean running = require(sessionId).cancel();
        log.info("Cancel requested [session={}, running={}]", sessionId, running);
        return running;
    }

    public PersistedAgentContext snapshot(String sessionId) {
        return require(sessionId).engine().exportContextSnapshot();
    }

    public String snapshotJson(String sessionId) {
        return snapshot(sessionId).toJson();
    }

    /**
     * Replace the session's conversation with a snapshot, creating the session
     * if needed.
     *
     * @throws SessionBusyException if the session is running a task
     */
    public void restore(String sessionId, String snapshotJson) {
        PersistedAgentContext snapshot = PersistedAgentContext.fromJson(snapshotJson);
        SessionHolder holder = sessions.computeIfAbsent(sessionId, this::newSession);
        if (!holder.lock.tryLock()) {
            throw new SessionBusyException(sessionId);
        }
        try {
            holder.engine().restoreContextFromSnapshot(snapshot);
        } finally {
            holder.lock.unlock();
        }
    }

    public Optional<Trajectory> trajectory(String sessionId) {
        return require(sessionId).engine().trajectoryRecorder().map(TrajectoryRecorder::toTrajectory);
    }

    /** Cancels any running task and forgets the session. */
    public void close(String sessionId) {
        SessionHolder holder = sessions.remove(sessionId);
        if (holder == null) {
            throw new SessionNotFoundException(sessionId);
        }
        holder.cancel();
        log.info("Closed session [session={}]", sessionId);
    }

    public boolean hasSession(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    private SessionHolder require(String sessionId) {
        SessionHolder holder = sessions.get(sessionId);
        if (holder == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return holder;
    }

    private SessionHolder newSession(String sessionId) {
        AgentProperties.Compression compression = properties.getCompression();
        Summarizer summarizer = compression.isLlmSummary() ? new LlmSummarizer(llmClient) : new DigestSummarizer();

        AgentEngine engine = AgentEngine.builder()
                .config(properties.toAgentConfig())
                .llmClient(llmClient)
                .toolRegistry(toolRegistry)
                .output(new LoggingOutput(sessionId, properties.isAutoApproveTools()))
                .conversationManager(new ConversationManager(
                        new TokenCalculator(),
                        summarizer,
                        compression.getTokenBudget(),
                        compression.getThreshold(),
                        compression.getMaxPayloadChars()))
                .trajectoryRecorder(newRecorder(sessionId))
                .stepExecutor(stepExecutor)
                .build();

        log.info("Created session [session={}, tools={}]", sessionId, engine.toolExecutor().listTools());
        return new SessionHolder(engine);
    }

    private TrajectoryRecorder newRecorder(String sessionId) {
        AgentProperties.Trajectory trajectory = properties.getTrajectory();
        if (!trajectory.isEnabled()) {
            return TrajectoryRecorder.inMemory();
        }
        return TrajectoryRecorder.withFile(
                Paths.get(trajectory.getDirectory()).resolve("trajectory_" + sessionId + ".json"));
    }

    /**
     * Engine plus run state of one session. Starting a task and cancelling
     * synchronize on the holder, so a cancel either finds no running task or
     * reaches the controller that task observes.
     */
    private static final class SessionHolder {

        private final AgentEngine engine;
        private final ReentrantLock lock = new ReentrantLock();
        private CancellationController active;

        SessionHolder(AgentEngine engine) {
            this.engine = engine;
        }

        AgentEngine engine() {
            return engine;
        }

        synchronized void begin(String sessionId) {
            if (!lock.tryLock()) {
                throw new SessionBusyException(sessionId);
            }
            active = CancellationController.create();
            engine.setCancellationController(active);
        }

        synchronized void end() {
            active = null;
            lock.unlock();
        }

        /** @return true if a running task was signalled */
        synchronized boolean cancel() {
            if (active == null) {
                return false;
            }
            active.cancel();
            return true;
        }
    }
}
