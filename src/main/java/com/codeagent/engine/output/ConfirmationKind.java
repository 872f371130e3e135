package com.codeagent.engine.output;

public enum ConfirmationKind {
    TOOL_EXECUTION
}
