package com.mimecast.pdbconf.config.schema;

import org.joda.time.Period;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Period strings such as <code>14d</code>, <code>12h</code>, <code>30m</code>, <code>10s</code> or <code>500ms</code>.
 */
public final class Periods {

    private static final Pattern PERIOD = Pattern.compile("(\\d+)(ms|d|h|m|s)");

    private Periods() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Is this a period string.
     *
     * @param text Candidate.
     * @return Boolean.
     */
    public static boolean isPeriod(String text) {
        Matcher matcher = PERIOD.matcher(text.trim());
        return matcher.matches() && fitsInt(matcher.group(1));
    }

    /**
     * Parses a period string.
     *
     * @param text Period string.
     * @return Single field period.
     * @throws IllegalArgumentException If the text is not a period.
     */
    public static Period parse(String text) {
        Matcher matcher = PERIOD.matcher(text.trim());
        if (!matcher.matches() || !fitsInt(matcher.group(1))) {
            throw new IllegalArgumentException("Invalid period " + text + ", expected e.g. 14d, 12h, 30m, 10s or 500ms");
        }
        int amount = Integer.parseInt(matcher.group(1));
        switch (matcher.group(2)) {
            case "d":
                return Period.days(amount);
            case "h":
                return Period.hours(amount);
            case "m":
                return Period.minutes(amount);
            case "s":
                return Period.seconds(amount);
            default:
                return Period.millis(amount);
        }
    }

    /**
     * Formats a period back to its string form.
     * <p>Periods spanning several fields are rendered in milliseconds.
     *
     * @param period Period.
     * @return Period string.
     */
    public static String format(Period period) {
        int[] values = {period.getDays(), period.getHours(), period.getMinutes(), period.getSeconds(), period.getMillis()};
        String[] units = {"d", "h", "m", "s", "ms"};

        int set = -1;
        for (int i = 0; i < values.length; i++) {
            if (values[i] != 0) {
                if (set != -1) {
                    return period.toStandardDuration().getMillis() + "ms";
                }
                set = i;
            }
        }
        return set == -1 ? "0d" : values[set] + units[set];
    }

    /**
     * Is the first period longer than the second.
     * <p>Days are taken as 24 hours.
     *
     * @param a First period.
     * @param b Second period.
     * @return Boolean.
     */
    public static boolean isLonger(Period a, Period b) {
        return a.toStandardDuration().isLongerThan(b.toStandardDuration());
    }

    private static boolean fitsInt(String digits) {
        try {
            Integer.parseInt(digits);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
