package com.codeagent.engine.config;

import com.codeagent.engine.model.AgentConfig;
import com.codeagent.engine.model.OutputMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the engine and its built-in tools.
 * Bound from application.yml under the "agent" prefix.
 */
@Component
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    private int maxSteps = 200;
    private boolean enableExtendedView = true;
    private List<String> tools = new ArrayList<>(AgentConfig.DEFAULT_TOOLS);
    private OutputMode outputMode = OutputMode.NORMAL;

    /** Optional override of the default coding-agent prompt */
    private String systemPrompt;

    /** Default project path when a task request does not name one */
    private String projectPath = ".";

    /** Approve confirmation-gated tools without asking; the REST host has no interactive user */
    private boolean autoApproveTools = false;

    private Compression compression = new Compression();
    private Trajectory trajectory = new Trajectory();
    private Bash bash = new Bash();
    private Edit edit = new Edit();

    @Data
    public static class Compression {
        /** Estimated token budget of the model context window */
        private int tokenBudget = 128_000;
        /** Fraction of the budget that triggers compression */
        private double threshold = 0.8;
        /** Max characters kept of a single payload at LIGHT level */
        private int maxPayloadChars = 4_000;
        /** Summarise dropped turns with the model instead of a plain digest */
        private boolean llmSummary = true;
    }

    @Data
    public static class Trajectory {
        private boolean enabled = true;
        private String directory = "trajectories";
    }

    @Data
    public static class Bash {
        private int timeoutSeconds = 120;
        private int maxOutputChars = 30_000;
        private boolean requireConfirmation = false;
    }

    @Data
    public static class Edit {
        private int maxFileSizeKb = 512;
    }

    public AgentConfig toAgentConfig() {
        return AgentConfig.builder()
                .maxSteps(maxSteps)
                .enableExtendedView(enableExtendedView)
                .tools(new ArrayList<>(tools))
                .outputMode(outputMode)
                .systemPrompt(systemPrompt)
                .build();
    }
}
