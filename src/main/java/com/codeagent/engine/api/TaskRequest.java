package com.codeagent.engine.api;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class TaskRequest {

    @NotBlank(message = "task must not be blank")
    private String task;

    /**
     * Optional. Directory the tools operate in; defaults to agent.project-path.
     */
    private String projectPath;
}
