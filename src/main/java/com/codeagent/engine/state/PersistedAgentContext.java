package com.codeagent.engine.state;

import com.codeagent.engine.config.JacksonConfig;
import com.codeagent.engine.exception.SnapshotException;
import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.ExecutionContext;
import com.codeagent.engine.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Versioned snapshot of an agent: configuration, conversation history and
 * execution context. Restoring one into a fresh engine continues the conversation.
 */
@Slf4j
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedAgentContext {

    public static final int CURRENT_VERSION = 1;

    private static final ObjectMapper MAPPER = JacksonConfig.newObjectMapper();

    @Builder.Default
    private int version = CURRENT_VERSION;

    private String agentType;

    @Builder.Default
    private Instant savedAt = Instant.now();

    /** Absent in snapshots that only carry history */
    private AgentConfig config;

    @Builder.Default
    private List<Message> conversationHistory = new ArrayList<>();

    private ExecutionContext executionContext;

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to serialize agent context", e);
        }
    }

    /**
     * @throws SnapshotException if the text is not a snapshot or has an unsupported version
     */
    public static PersistedAgentContext fromJson(String json) {
        PersistedAgentContext ctx;
        try {
            ctx = MAPPER.readValue(json, PersistedAgentContext.class);
        } catch (JsonProcessingException e) {
            throw new SnapshotException("Failed to parse agent context: " + e.getOriginalMessage(), e);
        }
        if (ctx == null) {
            throw new SnapshotException("Empty agent context document", null);
        }
        if (ctx.getVersion() > CURRENT_VERSION) {
            throw new SnapshotException("Unsupported snapshot version " + ctx.getVersion()
                    + " (max " + CURRENT_VERSION + ")", null);
        }
        if (ctx.getConversationHistory() == null) {
            ctx.setConversationHistory(new ArrayList<>());
        }
        return ctx;
    }

    /** Write the snapshot, creating missing parent directories. */
    public void toFile(Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, toJson(), StandardCharsets.UTF_8);
            log.info("Saved agent context to {} ({} messages)", path, conversationHistory.size());
        } catch (IOException e) {
            throw new SnapshotException("Failed to write agent context to " + path, e);
        }
    }

    public static PersistedAgentContext fromFile(Path path) {
        try {
            return fromJson(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SnapshotException("Failed to read agent context from " + path, e);
        }
    }
}
