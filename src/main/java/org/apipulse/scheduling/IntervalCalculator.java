package org.apipulse.scheduling;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes the next due time of a task from its interval expression.
 * <p>
 * Minutes and hours are added as exact durations. Days are added as calendar days in the
 * configured zone, so month ends and DST transitions land on the same local time.
 * No minimum or maximum interval is enforced here.
 */
public class IntervalCalculator {

    private static final Pattern EXPRESSION = Pattern.compile("^(\\d+)([mhd])$");

    private final ZoneId zone;

    public IntervalCalculator(ZoneId zone) {
        this.zone = zone == null ? ZoneOffset.UTC : zone;
    }

    public static IntervalCalculator utc() {
        return new IntervalCalculator(ZoneOffset.UTC);
    }

    public Instant nextRun(Instant base, String expression) {
        if (base == null) {
            throw new IllegalArgumentException("base time is required");
        }
        Interval interval = parse(expression);
        try {
            return switch (interval.unit()) {
                case MINUTES -> base.plusSeconds(Math.multiplyExact(interval.amount(), 60L));
                case HOURS -> base.plusSeconds(Math.multiplyExact(interval.amount(), 3600L));
                case DAYS -> base.atZone(zone).plusDays(interval.amount()).toInstant();
            };
        } catch (ArithmeticException | DateTimeException e) {
            throw new InvalidIntervalException(expression, "Interval out of range: " + expression);
        }
    }

    public static Interval parse(String expression) {
        if (expression == null) {
            throw new InvalidIntervalException(null, "Interval is required. Use: 5m, 1h, 1d, etc.");
        }
        Matcher m = EXPRESSION.matcher(expression);
        if (!m.matches()) {
            throw new InvalidIntervalException(expression,
                    "Invalid interval format '" + expression + "'. Use: 5m, 1h, 1d, etc.");
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            throw new InvalidIntervalException(expression, "Interval out of range: " + expression);
        }
        if (amount <= 0) {
            throw new InvalidIntervalException(expression, "Interval must be a positive number: " + expression);
        }
        return new Interval(amount, Interval.Unit.of(m.group(2).charAt(0)));
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidIntervalException e) {
            return false;
        }
    }
}
