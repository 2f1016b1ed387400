package com.proxymirror.intention;

public enum LocateError {
    NO_PRESENTER_CLASS(IntentionOutcome.NO_PRESENTER_CLASS),
    NO_PROXY_PROPERTY(IntentionOutcome.NO_PROXY_PROPERTY);

    private final IntentionOutcome outcome;

    LocateError(IntentionOutcome outcome) {
        this.outcome = outcome;
    }

    public IntentionOutcome outcome() {
        return outcome;
    }
}
