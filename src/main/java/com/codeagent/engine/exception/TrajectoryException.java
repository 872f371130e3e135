package com.codeagent.engine.exception;

/** Base type for trajectory persistence failures. */
public class TrajectoryException extends AgentException {

    public TrajectoryException(String message) {
        super(message);
    }

    public TrajectoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
