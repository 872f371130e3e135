package com.codeagent.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    private Role role;
    private MessageContent content;

    /** Free-form annotations, never sent to the model */
    private Map<String, Object> metadata;

    public static Message system(String text) {
        return of(Role.system, text);
    }

    public static Message user(String text) {
        return of(Role.user, text);
    }

    public static Message assistant(String text) {
        return of(Role.assistant, text);
    }

    public static Message assistant(List<ContentBlock> blocks) {
        return Message.builder().role(Role.assistant).content(MessageContent.blocks(blocks)).build();
    }

    /** Tool-role message carrying a single result for the given tool-use id. */
    public static Message toolResult(String toolUseId, boolean isError, String content) {
        return Message.builder()
                .role(Role.tool)
                .content(MessageContent.blocks(List.of(ContentBlock.toolResult(toolUseId, isError, content))))
                .build();
    }

    private static Message of(Role role, String text) {
        return Message.builder().role(role).content(MessageContent.text(text)).build();
    }

    /**
     * Text of the message. Text blocks are joined with newlines; empty when the
     * message carries no text at all.
     */
    public Optional<String> textContent() {
        if (content == null) return Optional.empty();
        if (content.isText()) return Optional.of(content.text());

        List<String> parts = content.blocks().stream()
                .filter(ContentBlock.Text.class::isInstance)
                .map(b -> ((ContentBlock.Text) b).getText())
                .toList();
        return parts.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", parts));
    }

    public boolean hasToolUse() {
        return !toolUses().isEmpty();
    }

    public List<ContentBlock.ToolUse> toolUses() {
        if (content == null || content.isText()) return List.of();
        return content.blocks().stream()
                .filter(ContentBlock.ToolUse.class::isInstance)
                .map(ContentBlock.ToolUse.class::cast)
                .collect(Collectors.toList());
    }

    public List<ContentBlock.ToolResult> toolResults() {
        if (content == null || content.isText()) return List.of();
        return content.blocks().stream()
                .filter(ContentBlock.ToolResult.class::isInstance)
                .map(ContentBlock.ToolResult.class::cast)
                .collect(Collectors.toList());
    }
}
