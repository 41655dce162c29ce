package com.sharedmodel.core.error;

/**
 * Caller is not the holder of the capability guarding the operation.
 */
public class PermissionException extends SharedModelException {

    public PermissionException(ErrorReason reason, String message) {
        super(checkCategory(reason, ErrorCategory.PERMISSION), message);
    }
}
