package com.codeagent.engine.output;

public record ConfirmationDecision(boolean approved, String note) {

    public static ConfirmationDecision approve() {
        return new ConfirmationDecision(true, null);
    }

    public static ConfirmationDecision deny(String note) {
        return new ConfirmationDecision(false, note);
    }
}
