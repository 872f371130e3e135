package com.codeagent.engine.compression;

import com.codeagent.engine.exception.CompressionException;
import com.codeagent.engine.model.ContentBlock;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.model.MessageContent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Keeps conversation history under the token budget.
 *
 * Compression triggers once the estimate exceeds {@code threshold * tokenBudget}.
 * The lowest {@link CompressionLevel} whose projected size lands under that
 * target is applied, CRITICAL if none does. The leading system message is
 * always kept and the verbatim tail never starts with an orphaned tool result.
 */
@Slf4j
public class ConversationManager {

    public static final double DEFAULT_THRESHOLD = 0.8;

    /** Tokens reserved for the summary message when projecting a summarising level */
    static final long SUMMARY_ALLOWANCE = 400;

    static final String SUMMARY_HEADER = "[Summary of earlier conversation]\n";

    private final TokenCalculator calculator;
    private final Summarizer summarizer;
    private final long tokenBudget;
    private final double threshold;
    private final int maxPayloadChars;

    public ConversationManager(TokenCalculator calculator,
                               Summarizer summarizer,
                               long tokenBudget,
                               double threshold,
                               int maxPayloadChars) {
        if (tokenBudget <= 0) throw new IllegalArgumentException("tokenBudget must be positive");
        if (threshold <= 0 || threshold > 1) throw new IllegalArgumentException("threshold must be in (0, 1]");
        this.calculator = calculator;
        this.summarizer = summarizer;
        this.tokenBudget = tokenBudget;
        this.threshold = threshold;
        this.maxPayloadChars = maxPayloadChars;
    }

    public static ConversationManager withDefaults(long tokenBudget) {
        return new ConversationManager(new TokenCalculator(), new DigestSummarizer(),
                tokenBudget, DEFAULT_THRESHOLD, 4_000);
    }

    /**
     * Compress the history if it is over the trigger, otherwise return it unchanged.
     *
     * @throws CompressionException if the selected level could not be applied
     */
    public CompressionResult maybeCompress(List<Message> messages, ExecutionContext context) {
        long tokensBefore = calculator.estimate(messages);
        long target = targetTokens();
        if (tokensBefore <= target) {
            return CompressionResult.unchanged(messages);
        }

        CompressionLevel level = selectLevel(messages, target);
        log.info("History at {} tokens exceeds target {}, applying {} compression",
                tokensBefore, target, level.asStr());

        List<Message> compressed;
        String description;
        try {
            if (level.summarises()) {
                Split split = split(messages, level.keepRecent());
                compressed = new ArrayList<>(split.head());
                if (!split.dropped().isEmpty()) {
                    String summary = summarizer.summarize(split.dropped(), context);
                    compressed.add(summaryMessage(summary, level));
                }
                compressed.addAll(truncatePayloads(split.tail()));
                description = String.format("%s compression: summarised %d messages, kept %d recent",
                        level.asStr(), split.dropped().size(), split.tail().size());
            } else {
                compressed = truncatePayloads(messages);
                description = "light compression: truncated oversized payloads";
            }
        } catch (CompressionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CompressionException(level.asStr() + " compression failed: " + e.getMessage(), e);
        }

        long tokensAfter = calculator.estimate(compressed);
        CompressionSummary summary = CompressionSummary.builder()
                .level(level)
                .tokensBefore(tokensBefore)
                .tokensAfter(tokensAfter)
                .tokensSaved(Math.max(0, tokensBefore - tokensAfter))
                .messagesBefore(messages.size())
                .messagesAfter(compressed.size())
                .summary(description)
                .build();
        return new CompressionResult(compressed, summary);
    }

    public ConversationTokenStats stats(List<Message> messages) {
        long estimated = calculator.estimate(messages);
        return new ConversationTokenStats(
                estimated,
                tokenBudget,
                (double) estimated / tokenBudget,
                messages.size(),
                estimated > targetTokens());
    }

    public long targetTokens() {
        return (long) (tokenBudget * threshold);
    }

    CompressionLevel selectLevel(List<Message> messages, long target) {
        for (CompressionLevel level : CompressionLevel.values()) {
            if (project(messages, level) < target) {
                return level;
            }
        }
        return CompressionLevel.CRITICAL;
    }

    private long project(List<Message> messages, CompressionLevel level) {
        if (!level.summarises()) {
            return calculator.estimate(truncatePayloads(messages));
        }
        Split split = split(messages, level.keepRecent());
        long projected = calculator.estimate(split.head()) + calculator.estimate(truncatePayloads(split.tail()));
        return split.dropped().isEmpty() ? projected : projected + SUMMARY_ALLOWANCE;
    }

    private Split split(List<Message> messages, int keepRecent) {
        List<Message> head = new ArrayList<>();
        int restStart = 0;
        if (!messages.isEmpty() && messages.get(0).getRole() == Message.Role.system) {
            head.add(messages.get(0));
            restStart = 1;
        }

        int tailStart = Math.max(restStart, messages.size() - keepRecent);
        while (tailStart < messages.size() && messages.get(tailStart).getRole() == Message.Role.tool) {
            tailStart++;
        }
        return new Split(head,
                new ArrayList<>(messages.subList(restStart, tailStart)),
                new ArrayList<>(messages.subList(tailStart, messages.size())));
    }

    private Message summaryMessage(String summary, CompressionLevel level) {
        return Message.builder()
                .role(Message.Role.user)
                .content(MessageContent.text(SUMMARY_HEADER + summary))
                .metadata(Map.of("compression_level", level.asStr()))
                .build();
    }

    List<Message> truncatePayloads(List<Message> messages) {
        List<Message> out = new ArrayList<>(messages.size());
        for (Message m : messages) {
            out.add(m.getRole() == Message.Role.system ? m : truncate(m));
        }
        return out;
    }

    private Message truncate(Message m) {
        MessageContent content = m.getContent();
        if (content == null) return m;

        if (content.isText()) {
            String text = content.text();
            return text.length() > maxPayloadChars ? copyWith(m, MessageContent.text(cut(text))) : m;
        }

        boolean changed = false;
        List<ContentBlock> blocks = new ArrayList<>(content.blocks().size());
        for (ContentBlock block : content.blocks()) {
            if (block instanceof ContentBlock.Text t && t.getText() != null && t.getText().length() > maxPayloadChars) {
                blocks.add(ContentBlock.text(cut(t.getText())));
                changed = true;
            } else if (block instanceof ContentBlock.ToolResult r && r.getContent() != null
                    && r.getContent().length() > maxPayloadChars) {
                blocks.add(new ContentBlock.ToolResult(r.getToolUseId(), r.getIsError(), cut(r.getContent())));
                changed = true;
            } else {
                blocks.add(block);
            }
        }
        return changed ? copyWith(m, MessageContent.blocks(blocks)) : m;
    }

    private String cut(String text) {
        int omitted = text.length() - maxPayloadChars;
        return text.substring(0, maxPayloadChars) + "\n[... " + omitted + " characters truncated ...]";
    }

    private static Message copyWith(Message m, MessageContent content) {
        return Message.builder().role(m.getRole()).content(content).metadata(m.getMetadata()).build();
    }

    private record Split(List<Message> head, List<Message> dropped, List<Message> tail) {}
}
