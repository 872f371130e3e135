package com.codeagent.engine.compression;

import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.Message;

import java.util.List;

/**
 * Cheap token estimate: roughly four characters per token plus a fixed
 * per-message overhead. Good enough to decide when to compress.
 */
public class TokenCalculator {

    static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD = 4;
    static final int IMAGE_TOKENS = 1_000;

    public long estimate(List<Message> messages) {
        long total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }

    public long estimate(Message message) {
        if (message.getContent() == null) return MESSAGE_OVERHEAD;
        if (message.getContent().isText()) {
            return MESSAGE_OVERHEAD + estimate(message.getContent().text());
        }

        long total = MESSAGE_OVERHEAD;
        for (ContentBlock block : message.getContent().blocks()) {
            if (block instanceof ContentBlock.Text t) {
                total += estimate(t.getText());
            } else if (block instanceof ContentBlock.ToolUse tu) {
                total += estimate(tu.getName()) + estimate(String.valueOf(tu.getInput()));
            } else if (block instanceof ContentBlock.ToolResult tr) {
                total += estimate(tr.getContent());
            } else if (block instanceof ContentBlock.Image) {
                total += IMAGE_TOKENS;
            }
        }
        return total;
    }

    public long estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
