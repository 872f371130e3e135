package com.codeagent.engine.exception;

import lombok.Getter;

@Getter
public class TrajectoryNotFoundException extends TrajectoryException {

    private final String path;

    public TrajectoryNotFoundException(String path) {
        super("Trajectory file not found: " + path);
        this.path = path;
    }
}
