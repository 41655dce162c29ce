package com.sharedmodel.core.error;

/**
 * Clock regressions and claims made before their wait period elapsed.
 */
public class TimingException extends SharedModelException {

    public TimingException(ErrorReason reason, String message) {
        super(checkCategory(reason, ErrorCategory.TIMING), message);
    }
}
