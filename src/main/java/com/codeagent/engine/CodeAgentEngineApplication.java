package com.codeagent.engine;

import com.codeagent.engine.llm.LlmProviderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LlmProviderProperties.class)
public class CodeAgentEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(CodeAgentEngineApplication.class, args);
    }
}
