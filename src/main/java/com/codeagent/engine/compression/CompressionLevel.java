package com.codeagent.engine.compression;

/**
 * Escalating compression strengths. LIGHT only truncates oversized payloads;
 * the others also summarise everything but the most recent messages.
 */
public enum CompressionLevel {

    LIGHT(-1),
    MEDIUM(20),
    HEAVY(10),
    CRITICAL(4);

    /** Recent messages kept verbatim; -1 keeps all */
    private final int keepRecent;

    CompressionLevel(int keepRecent) {
        this.keepRecent = keepRecent;
    }

    public int keepRecent() {
        return keepRecent;
    }

    public boolean summarises() {
        return keepRecent >= 0;
    }

    public String asStr() {
        return name().toLowerCase();
    }
}
