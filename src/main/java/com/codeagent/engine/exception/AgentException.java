package com.codeagent.engine.exception;

/**
 * Root of every failure the engine raises.
 * Setup, transport and persistence errors all extend this type.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
