package com.codeagent.engine.compression;

import com.codeagent.engine.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Last-resort history trim used when compression fails. Cannot fail.
 *
 * Keeps the leading system message, if there is one, followed by the most
 * recent messages so the result holds at most {@code maxMessages} entries.
 * Tool results whose tool use was trimmed away are dropped from the front.
 */
@Slf4j
public final class SimpleTrimmer {

    public static final int DEFAULT_MAX_MESSAGES = 50;

    private SimpleTrimmer() {}

    public static List<Message> trim(List<Message> messages, int maxMessages) {
        if (messages.size() <= maxMessages) {
            return new ArrayList<>(messages);
        }

        List<Message> result = new ArrayList<>();
        boolean keepSystem = !messages.isEmpty() && messages.get(0).getRole() == Message.Role.system;
        if (keepSystem) {
            result.add(messages.get(0));
        }

        int keepCount = Math.max(0, maxMessages - 1);
        int from = Math.max(keepSystem ? 1 : 0, messages.size() - keepCount);
        while (from < messages.size() && messages.get(from).getRole() == Message.Role.tool) {
            from++;
        }
        result.addAll(messages.subList(from, messages.size()));

        log.debug("Applied simple trim: {} -> {} messages", messages.size(), result.size());
        return result;
    }
}
