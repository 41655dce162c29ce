package com.sharedmodel.core.error;

/**
 * Payment and claim eligibility failures.
 */
public class EconomicException extends SharedModelException {

    public EconomicException(ErrorReason reason, String message) {
        super(checkCategory(reason, ErrorCategory.ECONOMIC), message);
    }
}
