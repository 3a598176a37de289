package com.econlens.core.model;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A calendar period: year plus subperiod code (M01..M13, Q01..Q05, S01..S03, A01).
 * Ordered by year, then by position of the subperiod within the year.
 */
public record PeriodKey(int year, String subperiod) implements Comparable<PeriodKey> {

    private static final Pattern SUBPERIOD = Pattern.compile("([MQSA])(\\d{2})");
    private static final Pattern KEY = Pattern.compile("(\\d{4})(?:-?([MQSAmqsa])(\\d{1,2}))?");

    public PeriodKey {
        if (subperiod == null) {
            throw new IllegalArgumentException("subperiod must not be null");
        }
        subperiod = subperiod.toUpperCase();
        if (!SUBPERIOD.matcher(subperiod).matches()) {
            throw new IllegalArgumentException("Invalid subperiod code: " + subperiod);
        }
        Periodicity periodicity = Periodicity.fromSubperiod(subperiod);
        int position = Integer.parseInt(subperiod.substring(1));
        int maxPosition = periodicity == Periodicity.ANNUAL ? 1 : periodicity.periodsPerYear() + 1;
        if (position < 1 || position > maxPosition) {
            throw new IllegalArgumentException("Subperiod out of range: " + subperiod);
        }
    }

    public static PeriodKey of(int year, String subperiod) {
        return new PeriodKey(year, subperiod);
    }

    public static PeriodKey month(int year, int month) {
        return new PeriodKey(year, Periodicity.MONTHLY.subperiodCode(month));
    }

    public static PeriodKey quarter(int year, int quarter) {
        return new PeriodKey(year, Periodicity.QUARTERLY.subperiodCode(quarter));
    }

    public static PeriodKey annual(int year) {
        return new PeriodKey(year, "A01");
    }

    /**
     * Parse "2023-M01", "2023M01", "2023Q1" or a bare "2023" (annual).
     */
    public static PeriodKey parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Period text is required");
        }
        Matcher m = KEY.matcher(text.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Unparseable period: " + text);
        }
        int year = Integer.parseInt(m.group(1));
        if (m.group(2) == null) {
            return annual(year);
        }
        int position = Integer.parseInt(m.group(3));
        return new PeriodKey(year, String.format("%s%02d", m.group(2).toUpperCase(), position));
    }

    public Periodicity periodicity() {
        return Periodicity.fromSubperiod(subperiod);
    }

    /**
     * 1-based position of the subperiod within its year.
     */
    public int position() {
        return Integer.parseInt(subperiod.substring(1));
    }

    public boolean isAnnualAverage() {
        return periodicity().isAnnualAverage(subperiod);
    }

    /**
     * Integer sort key, year * 100 + position.
     */
    public int sortKey() {
        return year * 100 + position();
    }

    @Override
    public int compareTo(PeriodKey other) {
        int c = Integer.compare(year, other.year);
        if (c != 0) return c;
        c = Integer.compare(position(), other.position());
        if (c != 0) return c;
        // Mixed periodicities within one year only need a stable tie-break
        return subperiod.compareTo(other.subperiod);
    }

    @Override
    public String toString() {
        return year + "-" + subperiod;
    }
}
