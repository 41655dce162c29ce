package com.sharedmodel.core.error;

/**
 * Precise failure reasons with stable codes for API clients.
 */
public enum ErrorReason {

    // Validation
    KEY_COLLISION("LEDGER_001", ErrorCategory.VALIDATION),
    MISMATCH("LEDGER_002", ErrorCategory.VALIDATION),
    NOT_FOUND("LEDGER_003", ErrorCategory.VALIDATION),

    // Permission
    UNAUTHORIZED("ACCESS_001", ErrorCategory.PERMISSION),

    // Timing
    CLOCK_REGRESSION("TIME_001", ErrorCategory.TIMING),
    TOO_EARLY("TIME_002", ErrorCategory.TIMING),

    // Economic
    INSUFFICIENT_PAYMENT("INCENTIVE_001", ErrorCategory.ECONOMIC),
    NOTHING_TO_CLAIM("INCENTIVE_002", ErrorCategory.ECONOMIC),
    ALREADY_CLAIMED("INCENTIVE_003", ErrorCategory.ECONOMIC),
    NO_STANDING("INCENTIVE_004", ErrorCategory.ECONOMIC),
    SELF_REPORT("INCENTIVE_005", ErrorCategory.ECONOMIC),
    MODEL_AGREES("INCENTIVE_006", ErrorCategory.ECONOMIC),
    MODEL_DISAGREES("INCENTIVE_007", ErrorCategory.ECONOMIC),

    // Arithmetic
    INSUFFICIENT_BALANCE("MATH_001", ErrorCategory.ARITHMETIC),
    OVERFLOW("MATH_002", ErrorCategory.ARITHMETIC),
    UNDERFLOW("MATH_003", ErrorCategory.ARITHMETIC),
    DIVISION_BY_ZERO("MATH_004", ErrorCategory.ARITHMETIC),
    NEGATIVE_AMOUNT("MATH_005", ErrorCategory.ARITHMETIC);

    private final String code;
    private final ErrorCategory category;

    ErrorReason(String code, ErrorCategory category) {
        this.code = code;
        this.category = category;
    }

    public String code() { return code; }
    public ErrorCategory category() { return category; }
}
