package com.econlens.core.model;

/**
 * Human-readable period labels ("January 2024", "Q3 2023", "Annual 2022").
 */
public final class PeriodNames {

    private static final String[] MONTHS = {
        "January", "February", "March", "April", "May", "June",
        "July", "August", "September", "October", "November", "December"
    };

    private static final String[] SHORT_MONTHS = {
        "Jan", "Feb", "Mar", "Apr", "May", "Jun", "Jul", "Aug", "Sep", "Oct", "Nov", "Dec"
    };

    private PeriodNames() {}

    /**
     * Name of the subperiod alone: "January", "Q2", "H1", "Annual".
     */
    public static String subperiodName(PeriodKey key) {
        Periodicity p = key.periodicity();
        if (p == Periodicity.ANNUAL || key.isAnnualAverage()) {
            return "Annual";
        }
        int pos = key.position();
        return switch (p) {
            case MONTHLY -> MONTHS[pos - 1];
            case QUARTERLY -> "Q" + pos;
            case SEMIANNUAL -> "H" + pos;
            default -> key.subperiod();
        };
    }

    public static String displayName(PeriodKey key) {
        return subperiodName(key) + " " + key.year();
    }

    /**
     * Compact axis label: "Jan 24", "Q3 23", "2022".
     */
    public static String shortName(PeriodKey key) {
        String yy = String.format("%02d", Math.floorMod(key.year(), 100));
        if (key.periodicity() == Periodicity.ANNUAL || key.isAnnualAverage()) {
            return String.valueOf(key.year());
        }
        return switch (key.periodicity()) {
            case MONTHLY -> SHORT_MONTHS[key.position() - 1] + " " + yy;
            case QUARTERLY -> "Q" + key.position() + " " + yy;
            case SEMIANNUAL -> "H" + key.position() + " " + yy;
            default -> key.toString();
        };
    }
}
