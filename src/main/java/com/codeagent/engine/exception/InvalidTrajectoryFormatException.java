package com.codeagent.engine.exception;

/** The file exists but does not hold a trajectory document. */
public class InvalidTrajectoryFormatException extends TrajectoryException {

    public InvalidTrajectoryFormatException(String path, Throwable cause) {
        super("Invalid trajectory format: " + path, cause);
    }
}
