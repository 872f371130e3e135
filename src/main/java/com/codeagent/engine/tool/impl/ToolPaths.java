package com.codeagent.engine.tool.impl;

import com.codeagent.engine.model.ToolCall;

import java.nio.file.Path;
import java.nio.file.Paths;

/** Resolves paths for built-in tools against the project the call runs in. */
final class ToolPaths {

    private ToolPaths() {}

    static Path projectRoot(ToolCall call) {
        Object root = call.getMetadata() != null ? call.getMetadata().get(ToolCall.PROJECT_PATH_KEY) : null;
        String dir = root instanceof String s && !s.isBlank() ? s : ".";
        return Paths.get(dir).toAbsolutePath().normalize();
    }

    /**
     * Resolves a path inside the project root.
     * Throws SecurityException if the path escapes the root.
     */
    static Path resolveSafePath(Path root, String path) {
        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new SecurityException("Path escapes project directory: '" + path + "'");
        }
        return resolved;
    }
}
