package com.sharedmodel.core.error;

/**
 * Checked unsigned arithmetic failures. Amounts never wrap.
 */
public class ArithmeticViolationException extends SharedModelException {

    public ArithmeticViolationException(ErrorReason reason, String message) {
        super(checkCategory(reason, ErrorCategory.ARITHMETIC), message);
    }
}
