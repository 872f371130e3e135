package com.codeagent.engine.trajectory;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrajectoryMetadata {

    public static final String FORMAT_VERSION = "1.0";

    private String id;
    private Instant startedAt;
    private Instant completedAt;
    private String version;
    private String agentType;
    private String task;
    private Boolean success;

    /** Highest step number seen across entries */
    private int totalSteps;

    private Long durationMs;
}
