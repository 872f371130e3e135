package com.codeagent.engine.exception;

public class CompressionException extends AgentException {

    public CompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
