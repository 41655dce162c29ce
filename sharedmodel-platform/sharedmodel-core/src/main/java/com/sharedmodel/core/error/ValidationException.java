package com.sharedmodel.core.error;

/**
 * Key, tuple and lookup failures.
 */
public class ValidationException extends SharedModelException {

    public ValidationException(ErrorReason reason, String message) {
        super(checkCategory(reason, ErrorCategory.VALIDATION), message);
    }
}
