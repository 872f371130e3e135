package com.codeagent.engine.output;

import java.util.Map;

/**
 * Approval prompt for a tool that requires confirmation. For tool executions the
 * metadata carries {@code tool_name}, {@code parameters} and {@code tool_call_id}.
 */
public record ConfirmationRequest(String id,
                                  ConfirmationKind kind,
                                  String title,
                                  String message,
                                  Map<String, Object> metadata) {
}
