package com.econlens.core.align;

/**
 * Base class for failures to resolve the active row of a comparison.
 */
public class PeriodResolutionException extends RuntimeException {

    public PeriodResolutionException(String message) {
        super(message);
    }
}
