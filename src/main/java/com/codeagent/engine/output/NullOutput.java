package com.codeagent.engine.output;

/** Discards every event. */
public class NullOutput implements AgentOutput {

    @Override
    public void emitEvent(AgentEvent event) {
    }
}
