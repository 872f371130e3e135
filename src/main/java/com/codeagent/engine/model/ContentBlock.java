package com.codeagent.engine.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One block of a multi-part message. Serialized with a {@code type} discriminator:
 * {@code text}, {@code image}, {@code tool_use}, {@code tool_result}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ContentBlock.Text.class, name = "text"),
        @JsonSubTypes.Type(value = ContentBlock.Image.class, name = "image"),
        @JsonSubTypes.Type(value = ContentBlock.ToolUse.class, name = "tool_use"),
        @JsonSubTypes.Type(value = ContentBlock.ToolResult.class, name = "tool_result")
})
public abstract class ContentBlock {

    public static Text text(String text) {
        return new Text(text);
    }

    public static ToolUse toolUse(String id, String name, Map<String, Object> input) {
        return new ToolUse(id, name, input);
    }

    public static ToolResult toolResult(String toolUseId, boolean isError, String content) {
        return new ToolResult(toolUseId, isError, content);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Text extends ContentBlock {
        private String text;
    }

    /** Base64 image payload. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class Image extends ContentBlock {
        private String data;
        private String mimeType;
    }

    /** A tool invocation requested by the model. The id pairs it with its result. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ToolUse extends ContentBlock {
        private String id;
        private String name;
        private Map<String, Object> input;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ToolResult extends ContentBlock {
        private String toolUseId;
        private Boolean isError;
        private String content;
    }
}
