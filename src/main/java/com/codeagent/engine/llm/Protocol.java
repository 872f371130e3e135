package com.codeagent.engine.llm;

public enum Protocol {
    OPENAI_COMPAT,
    ANTHROPIC,
    AZURE_OPENAI,
    GOOGLE_AI,
    CUSTOM
}
