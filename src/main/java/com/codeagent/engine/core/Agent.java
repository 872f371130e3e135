package com.codeagent.engine.core;

import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.AgentExecution;
import com.codeagent.engine.trajectory.TrajectoryRecorder;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A task-executing agent. One task runs at a time per instance; callers serialise access.
 */
public interface Agent {

    /** Run a task against the current working directory. */
    AgentExecution executeTask(String task);

    /**
     * Run a task against {@code projectPath}, continuing the existing conversation.
     * Never throws for task-level outcomes: failures and interruptions are reported
     * in the returned {@link AgentExecution}.
     */
    AgentExecution executeTaskWithContext(String task, Path projectPath);

    AgentConfig config();

    String agentType();

    void setTrajectoryRecorder(TrajectoryRecorder recorder);

    Optional<TrajectoryRecorder> trajectoryRecorder();
}
