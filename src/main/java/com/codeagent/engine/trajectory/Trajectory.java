package com.codeagent.engine.trajectory;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** The persisted document: metadata plus every entry in recording order. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Trajectory {
    private TrajectoryMetadata metadata;
    private List<TrajectoryEntry> entries;
}
