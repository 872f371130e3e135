package com.codeagent.engine.llm;

import com.codeagent.engine.exception.LlmException;
import com.codeagent.engine.model.LlmResponse;
import com.codeagent.engine.model.Message;
import com.codeagent.engine.tool.ToolDefinition;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Decorator that retries transient model failures.
 *
 * Only {@link LlmException#isRetryable()} failures are retried: network errors,
 * 429 and 5xx. Authentication and other 4xx failures propagate on the first attempt.
 * When attempts are exhausted the last failure propagates unchanged.
 */
@Slf4j
public class RetryingLlmClient implements LlmClient {

    private final LlmClient delegate;
    private final Retry retry;

    public RetryingLlmClient(LlmClient delegate, int maxAttempts, Duration waitDuration) {
        this.delegate = delegate;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(waitDuration)
                .retryOnException(e -> e instanceof LlmException le && le.isRetryable())
                .build();
        this.retry = Retry.of("llmClient-" + delegate.providerName(), config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("LLM call failed, retrying [provider={}, attempt={}]: {}",
                        delegate.providerName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    @Override
    public LlmResponse chatCompletion(List<Message> messages, List<ToolDefinition> tools, ChatOptions options) {
        return Retry.decorateSupplier(retry, () -> delegate.chatCompletion(messages, tools, options)).get();
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    @Override
    public String providerName() {
        return delegate.providerName();
    }
}
