package com.econlens.core.align;

/**
 * Live-mode resolution found no row with a value for any requested series.
 */
public class NoDataException extends PeriodResolutionException {

    public NoDataException() {
        super("No aligned row has data for the requested series");
    }
}
