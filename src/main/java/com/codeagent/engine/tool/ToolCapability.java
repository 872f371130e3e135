package com.codeagent.engine.tool;

/**
 * Flags a tool declares to get special treatment from the engine.
 */
public enum ToolCapability {

    /** A successful call ends the task with success. */
    COMPLETION_SIGNAL,

    /** Results carry the model's reasoning and are surfaced as thinking events. */
    THOUGHT_STREAM
}
