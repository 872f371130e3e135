package com.codeagent.engine.compression;

import com.codeagent.engine.exception.CompressionException;
import com.codeagent.engine.exception.LlmException;
import com.codeagent.engine.llm.ChatOptions;
import com.codeagent.engine.llm.LlmClient;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Asks the model to summarise the dropped turns.
 */
@Slf4j
public class LlmSummarizer implements Summarizer {

    private static final String SUMMARY_PROMPT = """
            You compress the history of a coding agent. Summarise the conversation below
            in at most 300 words. Keep file paths, commands run, decisions made, errors seen
            and what remains to be done. Output only the summary.
            """;

    static final int MAX_TRANSCRIPT_CHARS = 60_000;
    static final int SUMMARY_MAX_TOKENS = 1_024;

    private final LlmClient llmClient;

    public LlmSummarizer(LlmClient llmClient) {
        this.llmClient = llmClient;
    }

    @Override
    public String summarize(List<Message> dropped, ExecutionContext context) {
        StringBuilder transcript = new StringBuilder();
        if (context != null && context.getOriginalGoal() != null) {
            transcript.append("Original goal: ").append(context.getOriginalGoal()).append("\n\n");
        }
        for (Message m : dropped) {
            transcript.append(m.getRole()).append(": ").append(render(m)).append('\n');
            if (transcript.length() > MAX_TRANSCRIPT_CHARS) {
                transcript.setLength(MAX_TRANSCRIPT_CHARS);
                transcript.append("\n[transcript truncated]");
                break;
            }
        }

        try {
            LlmResponse response = llmClient.chatCompletion(
                    List.of(Message.system(SUMMARY_PROMPT), Message.user(transcript.toString())),
                    List.of(),
                    ChatOptions.builder().maxTokens(SUMMARY_MAX_TOKENS).temperature(0.0).build());
            String summary = response.getMessage().textContent().orElse("");
            if (summary.isBlank()) {
                throw new CompressionException("Model returned an empty summary", null);
            }
            log.debug("Summarised {} messages into {} chars", dropped.size(), summary.length());
            return summary.strip();
        } catch (LlmException e) {
            throw new CompressionException("Summarisation request failed: " + e.getMessage(), e);
        }
    }

    private String render(Message m) {
        StringBuilder sb = new StringBuilder(m.textContent().orElse(""));
        m.toolUses().forEach(tu -> sb.append(" [tool_use ").append(tu.getName()).append(' ')
                .append(tu.getInput()).append(']'));
        m.toolResults().forEach(tr -> sb.append(" [tool_result")
                .append(Boolean.TRUE.equals(tr.getIsError()) ? " error" : "")
                .append("] ").append(tr.getContent()));
        return sb.toString();
    }
}
