package com.duckora.types;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Engine interval value: months, days and microseconds kept separately.
 *
 * <p>Remote year-to-month intervals only populate {@code months}; day-to-second
 * intervals populate {@code days} and {@code micros}.
 */
public record IntervalValue(int months, int days, long micros) {

    // "[-]Y-M", as rendered by the driver for INTERVAL YEAR TO MONTH
    private static final Pattern YEAR_TO_MONTH = Pattern.compile("^([+-])?(\\d+)-(\\d+)$");
    // "[-]D H:M:S[.F]", as rendered by the driver for INTERVAL DAY TO SECOND
    private static final Pattern DAY_TO_SECOND =
        Pattern.compile("^([+-])?(\\d+) (\\d+):(\\d+):(\\d+)(?:\\.(\\d{1,9}))?$");

    /**
     * Parses the driver's textual form of an interval.
     *
     * @param text {@code "1-2"} (1 year 2 months) or {@code "1 2:3:4.5"}
     *             (1 day 2 hours 3 minutes 4.5 seconds), optionally signed
     * @return the interval
     * @throws IllegalArgumentException if the text is in neither form
     */
    public static IntervalValue parse(String text) {
        String trimmed = text.trim();

        Matcher ym = YEAR_TO_MONTH.matcher(trimmed);
        if (ym.matches()) {
            int sign = "-".equals(ym.group(1)) ? -1 : 1;
            int months = Integer.parseInt(ym.group(2)) * 12 + Integer.parseInt(ym.group(3));
            return new IntervalValue(sign * months, 0, 0L);
        }

        Matcher ds = DAY_TO_SECOND.matcher(trimmed);
        if (ds.matches()) {
            int sign = "-".equals(ds.group(1)) ? -1 : 1;
            int days = Integer.parseInt(ds.group(2));
            long micros = Long.parseLong(ds.group(3)) * 3_600_000_000L
                + Long.parseLong(ds.group(4)) * 60_000_000L
                + Long.parseLong(ds.group(5)) * 1_000_000L
                + fractionToMicros(ds.group(6));
            return new IntervalValue(0, sign * days, sign * micros);
        }

        throw new IllegalArgumentException("Unrecognized interval text: " + text);
    }

    private static long fractionToMicros(String fraction) {
        if (fraction == null) {
            return 0L;
        }
        String padded = (fraction + "000000000").substring(0, 9);
        // nanoseconds truncated to microseconds
        return Long.parseLong(padded) / 1000L;
    }

    public long nanos() {
        return micros * 1000L;
    }
}
