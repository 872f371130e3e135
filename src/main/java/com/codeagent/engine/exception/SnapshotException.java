package com.codeagent.engine.exception;

/** Reading or writing a persisted agent context failed. */
public class SnapshotException extends AgentException {

    public SnapshotException(String message, Throwable cause) {
        super(message, cause);
    }
}
