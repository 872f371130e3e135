package com.codeagent.engine.exception;

public class SessionNotFoundException extends AgentException {

    public SessionNotFoundException(String sessionId) {
        super("No agent session: " + sessionId);
    }
}
