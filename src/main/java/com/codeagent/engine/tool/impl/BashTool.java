package com.codeagent.engine.tool.impl;

import com.codeagent.engine.config.AgentProperties;
import com.codeagent.engine.exception.ToolExecutionException;
import com.codeagent.engine.model.ToolCall;
import com.codeagent.engine.tool.AgentTool;
import com.codeagent.engine.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs a shell command in the project directory.
 *
 * Output (stdout and stderr interleaved) is captured to a temp file and capped
 * at {@code agent.bash.max-output-chars}. A command still running after
 * {@code agent.bash.timeout-seconds} is killed.
 */
@Component
@Slf4j
public class BashTool implements AgentTool {

    private final AgentProperties properties;

    public BashTool(AgentProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getName() {
        return "bash";
    }

    @Override
    public String getDescription() {
        return """
                Run a bash command in the project directory and return its combined output
                and exit code. Use it to inspect the repository, build, and run tests.
                Long-running or interactive commands are killed after a timeout.
                """;
    }

    @Override
    public Map<String, Object> getInputSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "command", Map.of(
                                "type", "string",
                                "description", "The bash command to run"
                        )
                ),
                "required", List.of("command")
        );
    }

    @Override
    public boolean requiresConfirmation() {
        return properties.getBash().isRequireConfirmation();
    }

    @Override
    public ToolResult execute(ToolCall call) {
        Object command = call.getParameters() != null ? call.getParameters().get("command") : null;
        if (!(command instanceof String cmd) || cmd.isBlank()) {
            return ToolResult.error(call.getId(), "'command' is required");
        }

        File workDir = ToolPaths.projectRoot(call).toFile();
        int timeout = properties.getBash().getTimeoutSeconds();

        Path output = null;
        try {
            output = Files.createTempFile("bash-tool-", ".out");
            Process process = new ProcessBuilder("bash", "-c", cmd)
                    .directory(workDir)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            log.info("Running command [dir={}]: {}", workDir, cmd);
            if (!process.waitFor(timeout, TimeUnit.SECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                return ToolResult.error(call.getId(),
                        String.format("Command timed out after %d seconds: %s", timeout, cmd));
            }

            int exitCode = process.exitValue();
            String text = truncate(Files.readString(output, StandardCharsets.UTF_8));
            String content = text + (text.endsWith("\n") || text.isEmpty() ? "" : "\n") + "Exit code: " + exitCode;
            return exitCode == 0
                    ? ToolResult.success(call.getId(), content)
                    : ToolResult.error(call.getId(), content);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.error(call.getId(), "Command interrupted: " + cmd);
        } catch (IOException e) {
            throw new ToolExecutionException("Failed to run command: " + e.getMessage(), e);
        } finally {
            deleteQuietly(output);
        }
    }

    private String truncate(String text) {
        int max = properties.getBash().getMaxOutputChars();
        if (text.length() <= max) return text;
        return text.substring(0, max) + "\n... [output truncated, " + (text.length() - max) + " chars omitted]\n";
    }

    private void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete temp output {}: {}", path, e.getMessage());
        }
    }
}
