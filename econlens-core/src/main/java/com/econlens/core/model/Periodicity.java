package com.econlens.core.model;

/**
 * Sampling frequency of a series.
 * Drives the year-over-year lag and the ordering of subperiod codes.
 */
public enum Periodicity {
    /**
     * Months M01..M12, annual average M13
     */
    MONTHLY(12, "M", "Monthly"),

    /**
     * Quarters Q01..Q04, annual value Q05
     */
    QUARTERLY(4, "Q", "Quarterly"),

    /**
     * Halves S01..S02, annual value S03
     */
    SEMIANNUAL(2, "S", "Semiannual"),

    /**
     * One observation per year, A01
     */
    ANNUAL(1, "A", "Annual");

    private final int periodsPerYear;
    private final String codePrefix;
    private final String displayName;

    Periodicity(int periodsPerYear, String codePrefix, String displayName) {
        this.periodsPerYear = periodsPerYear;
        this.codePrefix = codePrefix;
        this.displayName = displayName;
    }

    public int periodsPerYear() {
        return periodsPerYear;
    }

    public String codePrefix() {
        return codePrefix;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Subperiod code the agencies use for the annual figure (M13, Q05, S03, A01).
     */
    public String annualAverageCode() {
        if (this == ANNUAL) return "A01";
        return String.format("%s%02d", codePrefix, periodsPerYear + 1);
    }

    /**
     * Build the subperiod code for a 1-based position within the year.
     */
    public String subperiodCode(int position) {
        if (position < 1 || position > periodsPerYear + 1) {
            throw new IllegalArgumentException(displayName + " position out of range: " + position);
        }
        if (this == ANNUAL) return "A01";
        return String.format("%s%02d", codePrefix, position);
    }

    /**
     * Whether the code is this periodicity's annual pseudo-period.
     */
    public boolean isAnnualAverage(String subperiod) {
        return this != ANNUAL && annualAverageCode().equals(subperiod);
    }

    /**
     * Resolve from a subperiod code such as "M03" or "Q05".
     */
    public static Periodicity fromSubperiod(String subperiod) {
        if (subperiod == null || subperiod.isEmpty()) {
            throw new IllegalArgumentException("Subperiod code is required");
        }
        char prefix = Character.toUpperCase(subperiod.charAt(0));
        for (Periodicity p : values()) {
            if (p.codePrefix.charAt(0) == prefix) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown subperiod code: " + subperiod);
    }

    /**
     * Parse a catalog periodicity code (BLS uses R/M for monthly), case-insensitive.
     * Returns null for unknown codes.
     */
    public static Periodicity fromCode(String code) {
        if (code == null) return null;
        return switch (code.trim().toUpperCase()) {
            case "R", "M", "MONTHLY" -> MONTHLY;
            case "Q", "QUARTERLY" -> QUARTERLY;
            case "S", "SEMIANNUAL" -> SEMIANNUAL;
            case "A", "ANNUAL" -> ANNUAL;
            default -> null;
        };
    }
}
