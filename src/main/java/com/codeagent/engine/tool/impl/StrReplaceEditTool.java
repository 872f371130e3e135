package com.codeagent.engine.tool.impl;

import com.codeagent.engine.config.AgentProperties;
import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.AgentTool;
import com.codeagent.engine.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * File viewing and editing tool.
 *
 * Commands: view, create, str_replace, insert
 *
 * - Paths resolve against the task's project directory and may not escape it
 * - str_replace requires old_str to occur exactly once
 * - Reads and writes are capped at agent.edit.max-file-size-kb
 */
@Component
@Slf4j
public class StrReplaceEditTool implements AgentTool {

    private final AgentProperties properties;

    public StrReplaceEditTool(AgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "str_replace_based_edit_tool";
    }

    @Override
    public String getDescription() {
        return """
                View, create and edit files in the project.
                * view: show a file with line numbers (optionally a view_range) or list a directory
                * create: write file_text to a new or existing file
                * str_replace: replace old_str, which must match exactly once, with new_str
                * insert: insert new_str after line insert_line (0 inserts at the top)
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of(
                                "type", "string",
                                "enum", List.of("view", "create", "str_replace", "insert"),
                                "description", "The operation to perform"
                        ),
                        "path", Map.of(
                                "type", "string",
                                "description", "File or directory path, relative to the project or absolute inside it"
                        ),
                        "file_text", Map.of("type", "string", "description", "Content for create"),
                        "old_str", Map.of("type", "string", "description", "Exact text to replace"),
                        "new_str", Map.of("type", "string", "description", "Replacement or inserted text"),
                        "insert_line", Map.of("type", "integer", "description", "Line after which to insert"),
                        "view_range", Map.of(
                                "type", "array",
                                "items", Map.of("type", "integer"),
                                "description", "[start, end] lines to view, 1-based; end -1 means to the end"
                        )
                ),
                "required", List.of("command", "path")
        );
    }

    @Override
    public ToolResult execute(ToolCall call) {
        Map<String, Object> args = call.getParameters() != null ? call.getParameters() : Map.of();
        String command = (String) args.get("command");
        String rawPath = (String) args.get("path");
        if (command == null || command.isBlank()) {
            return ToolResult.error(call.getId(), "'command' is required (view, create, str_replace, insert)");
        }
        if (rawPath == null || rawPath.isBlank()) {
            return ToolResult.error(call.getId(), "'path' is required");
        }

        Path path = ToolPaths.resolveSafePath(ToolPaths.projectRoot(call), rawPath);
        try {
            return switch (command) {
                case "view" -> view(call.getId(), path, args);
                case "create" -> create(call.getId(), path, args);
                case "str_replace" -> strReplace(call.getId(), path, args);
                case "insert" -> insert(call.getId(), path, args);
                default -> ToolResult.error(call.getId(), "Unknown command '" + command + "'");
            };
        } catch (IOException e) {
            throw new UncheckedIOException("Edit tool failed [command=" + command + ", path=" + rawPath + "]", e);
        }
    }

    private ToolResult view(String id, Path path, Map<String, Object> args) throws IOException {
        if (!Files.exists(path)) {
            return ToolResult.error(id, "Path not found: " + path);
        }
        if (Files.isDirectory(path)) {
            StringBuilder sb = new StringBuilder("Files in '").append(path).append("' (depth 2):\n");
            try (var stream = Files.walk(path, 2)) {
                stream.filter(p -> !p.equals(path))
                        .filter(p -> !p.getFileName().toString().startsWith("."))
                        .sorted()
                        .forEach(p -> sb.append("  ").append(path.relativize(p))
                                .append(Files.isDirectory(p) ? "/" : "").append('\n'));
            }
            return ToolResult.success(id, sb.toString());
        }

        String tooLarge = checkSize(path);
        if (tooLarge != null) return ToolResult.error(id, tooLarge);

        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        int start = 1;
        int end = lines.size();
        if (args.get("view_range") instanceof List<?> range && range.size() == 2
                && range.get(0) instanceof Number s && range.get(1) instanceof Number e) {
            start = Math.max(1, s.intValue());
            end = e.intValue() == -1 ? lines.size() : Math.min(lines.size(), e.intValue());
            if (start > end) {
                return ToolResult.error(id, "Invalid view_range " + range + " for file with " + lines.size() + " lines");
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = start; i <= end; i++) {
            sb.append(String.format("%6d\t%s%n", i, lines.get(i - 1)));
        }
        return ToolResult.success(id, sb.toString());
    }

    private ToolResult create(String id, Path path, Map<String, Object> args) throws IOException {
        String text = (String) args.get("file_text");
        if (text == null) return ToolResult.error(id, "'file_text' is required for create");
        if (text.length() > maxBytes()) {
            return ToolResult.error(id, String.format("Content too large (%d bytes). Max: %d KB",
                    text.length(), properties.getEdit().getMaxFileSizeKb()));
        }

        if (path.getParent() != null) Files.createDirectories(path.getParent());
        Files.writeString(path, text, StandardCharsets.UTF_8);
        log.info("Created file: {} ({} bytes)", path, text.length());
        return ToolResult.success(id, "File created successfully at: " + path);
    }

    private ToolResult strReplace(String id, Path path, Map<String, Object> args) throws IOException {
        String oldStr = (String) args.get("old_str");
        String newStr = args.get("new_str") instanceof String s ? s : "";
        if (oldStr == null || oldStr.isEmpty()) return ToolResult.error(id, "'old_str' is required for str_replace");
        if (!Files.isRegularFile(path)) return ToolResult.error(id, "File not found: " + path);

        String tooLarge = checkSize(path);
        if (tooLarge != null) return ToolResult.error(id, tooLarge);

        String content = Files.readString(path, StandardCharsets.UTF_8);
        int first = content.indexOf(oldStr);
        if (first < 0) {
            return ToolResult.error(id, "No replacement was performed, old_str did not appear verbatim in " + path);
        }
        if (content.indexOf(oldStr, first + 1) >= 0) {
            return ToolResult.error(id, "No replacement was performed. Multiple occurrences of old_str in "
                    + path + ". Include more context to make it unique");
        }

        String updated = content.substring(0, first) + newStr + content.substring(first + oldStr.length());
        Files.writeString(path, updated, StandardCharsets.UTF_8);
        log.info("Edited file: {}", path);
        return ToolResult.success(id, "The file " + path + " has been edited.");
    }

    private ToolResult insert(String id, Path path, Map<String, Object> args) throws IOException {
        String newStr = (String) args.get("new_str");
        if (newStr == null) return ToolResult.error(id, "'new_str' is required for insert");
        if (!(args.get("insert_line") instanceof Number lineArg)) {
            return ToolResult.error(id, "'insert_line' is required for insert");
        }
        if (!Files.isRegularFile(path)) return ToolResult.error(id, "File not found: " + path);

        List<String> lines = new ArrayList<>(Files.readAllLines(path, StandardCharsets.UTF_8));
        int line = lineArg.intValue();
        if (line < 0 || line > lines.size()) {
            return ToolResult.error(id, "Invalid insert_line " + line + ". Valid range: [0, " + lines.size() + "]");
        }

        lines.addAll(line, Arrays.asList(newStr.split("\n", -1)));
        Files.write(path, lines, StandardCharsets.UTF_8);
        log.info("Inserted {} chars into {} after line {}", newStr.length(), path, line);
        return ToolResult.success(id, "The file " + path + " has been edited.");
    }

    private String checkSize(Path path) throws IOException {
        long sizeKb = Files.size(path) / 1024;
        int maxKb = properties.getEdit().getMaxFileSizeKb();
        return sizeKb > maxKb ? String.format("File too large (%d KB). Max allowed: %d KB", sizeKb, maxKb) : null;
    }

    private int maxBytes() {
        return properties.getEdit().getMaxFileSizeKb() * 1024;
    }
}
