package com.codeagent.engine.output;

import lombok.extern.slf4j.Slf4j;

/**
 * Wraps a sink so emission and flush failures are logged and dropped, and a
 * failed confirmation request resolves to a denial.
 */
@Slf4j
public class SafeOutput {

    static final String CONFIRMATION_FAILED = "Failed to obtain confirmation";

    private final AgentOutput delegate;

    public SafeOutput(AgentOutput delegate) {
        this.delegate = delegate;
    }

    public void emit(AgentEvent event) {
        try {
            delegate.emitEvent(event);
        } catch (Exception e) {
            log.debug("Failed to emit {} event: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    public ConfirmationDecision requestConfirmation(ConfirmationRequest request) {
        try {
            ConfirmationDecision decision = delegate.requestConfirmation(request);
            return decision != null ? decision : ConfirmationDecision.deny(CONFIRMATION_FAILED);
        } catch (Exception e) {
            log.warn("Confirmation request failed [id={}]: {}", request.id(), e.getMessage());
            return ConfirmationDecision.deny(CONFIRMATION_FAILED);
        }
    }

    public void flush() {
        try {
            delegate.flush();
        } catch (Exception e) {
            log.debug("Failed to flush output: {}", e.getMessage());
        }
    }

    public AgentOutput delegate() {
        return delegate;
    }
}
