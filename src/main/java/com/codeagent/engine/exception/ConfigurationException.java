package com.codeagent.engine.exception;

/**
 * Setup failure: an unsupported provider, a missing credential or an invalid
 * agent configuration detected while assembling the engine.
 */
public class ConfigurationException extends AgentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
