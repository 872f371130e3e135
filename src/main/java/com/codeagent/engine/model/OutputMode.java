package com.codeagent.engine.model;

public enum OutputMode {
    /** Detailed logging and verbose output */
    DEBUG,
    /** Clean, user-facing output */
    NORMAL
}
