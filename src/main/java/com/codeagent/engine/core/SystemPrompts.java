package com.codeagent.engine.core;

import java.nio.file.Path;
import java.util.List;

/**
 * Builds the system message for an agent.
 *
 * A configured prompt gets generic system context only. The default prompt
 * also names the project root. Both end with the list of available tools.
 */
public final class SystemPrompts {

    private static final String DEFAULT_PROMPT = """
            You are an expert software engineering agent. You complete coding tasks in the
            repository by inspecting files, running commands and editing code with the tools
            available to you.

            Guidelines:
            1. Explore the relevant code before changing it.
            2. Reproduce a bug before fixing it when you can.
            3. Make focused edits. Use absolute paths or paths relative to the project root.
            4. Verify your work by running builds or tests.
            5. Use sequentialthinking to plan non-trivial work.
            6. Call task_done once the task is complete and verified.
            """;

    private SystemPrompts() {}

    public static String build(String configuredPrompt, Path projectPath, List<String> toolNames) {
        String base = configuredPrompt != null
                ? configuredPrompt + "\n\n[System Context]:\n" + systemContext()
                : defaultPrompt(projectPath);
        return base + "\n\nAvailable tools: " + String.join(", ", toolNames);
    }

    static String defaultPrompt(Path projectPath) {
        return DEFAULT_PROMPT
                + "\n[Project root path]:\n" + projectPath.toAbsolutePath().normalize()
                + "\n\n" + systemContext();
    }

    static String systemContext() {
        return "System Information:\n"
                + "- Operating System: " + System.getProperty("os.name") + " " + System.getProperty("os.version") + "\n"
                + "- Architecture: " + System.getProperty("os.arch") + "\n"
                + "- Java Runtime: " + System.getProperty("java.version");
    }
}
