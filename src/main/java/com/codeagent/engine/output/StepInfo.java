package com.codeagent.engine.output;

/** Step number and the task it belongs to. */
public record StepInfo(int stepNumber, String task) {
}
