package com.codeagent.engine.compression;

import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Model-free summary: counts of dropped turns and the tools they used.
 */
public class DigestSummarizer implements Summarizer {

    @Override
    public String summarize(List<Message> dropped, ExecutionContext context) {
        Map<String, Integer> toolCounts = new LinkedHashMap<>();
        int userTurns = 0;
        int assistantTurns = 0;
        for (Message m : dropped) {
            if (m.getRole() == Message.Role.user) userTurns++;
            if (m.getRole() == Message.Role.assistant) assistantTurns++;
            m.toolUses().forEach(tu -> toolCounts.merge(tu.getName(), 1, Integer::sum));
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%d earlier messages were removed (%d user, %d assistant).",
                dropped.size(), userTurns, assistantTurns));
        if (!toolCounts.isEmpty()) {
            sb.append(" Tools used: ");
            toolCounts.forEach((name, count) -> sb.append(name).append(" x").append(count).append(", "));
            sb.setLength(sb.length() - 2);
            sb.append('.');
        }
        return sb.toString();
    }
}
