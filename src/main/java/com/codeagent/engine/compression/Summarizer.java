package com.codeagent.engine.compression;

import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;

import java.util.List;

/**
 * Condenses the messages a compression pass drops into a short text.
 */
public interface Summarizer {

    /**
     * @param dropped messages being removed, oldest first, never empty
     * @param context current execution context, may be null
     * @throws com.codeagent.engine.exception.CompressionException if no summary could be produced
     */
    String summarize(List<Message> dropped, ExecutionContext context);
}
