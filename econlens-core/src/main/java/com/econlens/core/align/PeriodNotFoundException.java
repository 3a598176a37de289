package com.econlens.core.align;

import com.econlens.core.model.PeriodKey;

/**
 * The explicitly selected period has no row in the aligned timeline.
 * Callers should drop the selection and go back to live mode rather than retry.
 */
public class PeriodNotFoundException extends PeriodResolutionException {

    private final PeriodKey periodKey;

    public PeriodNotFoundException(PeriodKey periodKey) {
        super("No aligned row for period " + periodKey);
        this.periodKey = periodKey;
    }

    public PeriodKey getPeriodKey() {
        return periodKey;
    }
}
