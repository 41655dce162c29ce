package com.sharedmodel.core.error;

/**
 * Broad failure classes. A caller decides from the category whether waiting helps
 * ({@link #TIMING}) or the claim should be abandoned.
 */
public enum ErrorCategory {
    VALIDATION,
    PERMISSION,
    TIMING,
    ECONOMIC,
    ARITHMETIC
}
