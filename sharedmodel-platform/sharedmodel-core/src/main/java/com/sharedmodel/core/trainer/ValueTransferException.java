package com.sharedmodel.core.trainer;

/**
 * A payout that was committed in the ledger but could not be delivered.
 */
public class ValueTransferException extends RuntimeException {

    public ValueTransferException(String message) {
        super(message);
    }

    public ValueTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
