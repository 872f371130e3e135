package com.codeagent.engine.exception;

import lombok.Getter;

/**
 * Failure reported by a model capability.
 *
 * | Kind            | Meaning                                         |
 * |-----------------|-------------------------------------------------|
 * | AUTHENTICATION  | missing or rejected credential                  |
 * | NETWORK         | transport failure or unreadable response body   |
 * | INVALID_REQUEST | the request could not be built locally          |
 * | API_ERROR       | remote rejection, carries the HTTP status       |
 * | UNSUPPORTED     | capability not offered by this provider         |
 */
@Getter
public class LlmException extends AgentException {

    public enum Kind { AUTHENTICATION, NETWORK, INVALID_REQUEST, API_ERROR, UNSUPPORTED }

    private final Kind kind;

    /** HTTP status for {@link Kind#API_ERROR}, otherwise 0 */
    private final int status;

    public LlmException(Kind kind, String message) {
        this(kind, 0, message, null);
    }

    public LlmException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public LlmException(Kind kind, int status, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public static LlmException apiError(int status, String body) {
        return new LlmException(Kind.API_ERROR, status, "API error " + status + ": " + body, null);
    }

    /** Network failures and 429/5xx responses are worth another attempt; the rest are not. */
    public boolean isRetryable() {
        return kind == Kind.NETWORK || (kind == Kind.API_ERROR && (status == 429 || status >= 500));
    }
}
