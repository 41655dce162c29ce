package com.sharedmodel.core.error;

import java.util.Objects;

/**
 * Base of every ledger, engine and trainer failure. Subclasses fix the category;
 * the {@link ErrorReason} names the exact cause.
 */
public abstract class SharedModelException extends RuntimeException {

    private final ErrorReason reason;

    protected SharedModelException(ErrorReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public ErrorReason getReason() { return reason; }

    public ErrorCategory getCategory() { return reason.category(); }

    public String getCode() { return reason.code(); }

    static ErrorReason checkCategory(ErrorReason reason, ErrorCategory expected) {
        if (reason.category() != expected) {
            throw new IllegalArgumentException(reason + " is not a " + expected + " reason");
        }
        return reason;
    }
}
