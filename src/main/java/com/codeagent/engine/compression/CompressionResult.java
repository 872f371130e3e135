package com.codeagent.engine.compression;

import com.codeagent.engine.model.Message;

import java.util.List;

/**
 * Possibly compressed history. {@code compressionApplied} is null when the
 * history was returned unchanged.
 */
public record CompressionResult(List<Message> messages, CompressionSummary compressionApplied) {

    public static CompressionResult unchanged(List<Message> messages) {
        return new CompressionResult(messages, null);
    }

    public boolean isCompressed() {
        return compressionApplied != null;
    }
}
