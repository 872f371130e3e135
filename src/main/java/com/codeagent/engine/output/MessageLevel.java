package com.codeagent.engine.output;

public enum MessageLevel {
    DEBUG, NORMAL, INFO, WARNING, ERROR
}
