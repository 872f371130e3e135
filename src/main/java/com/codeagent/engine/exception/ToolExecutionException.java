package com.codeagent.engine.exception;

/**
 * Thrown by a tool that could not run. The engine converts it into an error
 * tool result; it never aborts the task by itself.
 */
public class ToolExecutionException extends AgentException {

    public ToolExecutionException(String message) {
        super(message);
    }

    public ToolExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
