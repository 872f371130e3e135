package com.codeagent.engine.exception;

public class SessionBusyException extends AgentException {

    public SessionBusyException(String sessionId) {
        super("Session is running a task: " + sessionId);
    }
}
