package com.econlens.core.context;

/**
 * Told when anything feeding a comparison changed (selection, frozen period, range,
 * newly arrived data). Implementations take a fresh {@link ComparisonContext#snapshot()}.
 * May be called from a fetch thread.
 */
@FunctionalInterface
public interface ComparisonListener {

    void onComparisonChanged(ComparisonContext context);
}
