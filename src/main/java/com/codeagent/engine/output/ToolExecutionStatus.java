package com.codeagent.engine.output;

public enum ToolExecutionStatus {
    EXECUTING, SUCCESS, ERROR
}
