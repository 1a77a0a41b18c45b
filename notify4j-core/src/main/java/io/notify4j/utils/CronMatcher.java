package io.notify4j.utils;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Evaluates five-field cron expressions ({@code minute hour day-of-month month day-of-week}).
 * <p>
 * Supported terms per field:
 * <ul>
 *   <li>{@code *} – any value</li>
 *   <li>literal integer, e.g. {@code 9}</li>
 *   <li>inclusive range, e.g. {@code 1-5}</li>
 *   <li>step over the whole field, e.g. {@code *}{@code /15} (matches when {@code value % 15 == 0})</li>
 *   <li>comma lists of the above, e.g. {@code 1,3,5}</li>
 * </ul>
 * Day-of-week runs from 0 (Sunday) to 6 (Saturday); 7 is accepted as another Sunday.
 * <p>
 * Day-of-month and day-of-week are combined with AND: a date fires only when month,
 * day-of-month and day-of-week all match.
 */
public final class CronMatcher {

    private static final int MINUTE = 0;
    private static final int HOUR = 1;
    private static final int DAY_OF_MONTH = 2;
    private static final int MONTH = 3;
    private static final int DAY_OF_WEEK = 4;

    private static final String[] FIELD_NAMES = {"minute", "hour", "day-of-month", "month", "day-of-week"};
    private static final int[][] BOUNDS = {{0, 59}, {0, 23}, {1, 31}, {1, 12}, {0, 7}};

    // 29 February can be eight years away (e.g. 2096 -> 2104).
    private static final int MAX_SEARCH_DAYS = 366 * 8;

    private static final Pattern DIGITS = Pattern.compile("\\d{1,9}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private CronMatcher() {
    }

    /**
     * Returns true if {@code value} satisfies a single cron field.
     * Malformed terms never match.
     */
    public static boolean matchField(String field, int value) {
        if (field == null) {
            return false;
        }
        String f = field.trim();
        if ("*".equals(f)) {
            return true;
        }
        for (String term : f.split(",")) {
            if (matchTerm(term.trim(), value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Like {@link #matchField(String, int)}, with 7 treated as an alias of Sunday (0).
     *
     * @param dayOfWeek 0 = Sunday ... 6 = Saturday
     */
    public static boolean matchDayOfWeek(String field, int dayOfWeek) {
        if (matchField(field, dayOfWeek)) {
            return true;
        }
        if (dayOfWeek != 0 || field == null) {
            return false;
        }
        for (String term : field.trim().split(",")) {
            String t = term.trim();
            // a step term already matched 0
            if (!t.startsWith("*/") && matchTerm(t, 7)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if the expression fires at some time on {@code date}.
     * Minute and hour are ignored; expressions without exactly five fields never fire.
     */
    public static boolean firesOnDate(String cron, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        String[] fields = fields(cron);
        return fields != null && firesOnDate(fields, date);
    }

    /**
     * Earliest time of day at which the expression fires on {@code date}, if it fires on that date at all.
     */
    public static Optional<LocalTime> firstFireOn(String cron, LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        String[] fields = fields(cron);
        if (fields == null || !firesOnDate(fields, date)) {
            return Optional.empty();
        }
        for (int h = 0; h < 24; h++) {
            if (!matchField(fields[HOUR], h)) {
                continue;
            }
            for (int m = 0; m < 60; m++) {
                if (matchField(fields[MINUTE], m)) {
                    return Optional.of(LocalTime.of(h, m));
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Computes the next fire time strictly after {@code from}, in {@code from}'s zone.
     *
     * @return next fire time, or empty when the expression never fires (e.g. {@code 0 0 31 2 *})
     */
    public static Optional<ZonedDateTime> nextFireAfter(String cron, ZonedDateTime from) {
        Objects.requireNonNull(from, "from must not be null");
        String[] fields = fields(cron);
        if (fields == null) {
            return Optional.empty();
        }

        ZoneId zone = from.getZone();
        ZonedDateTime start = from.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDate date = start.toLocalDate();
        LocalTime earliest = start.toLocalTime();

        for (int i = 0; i < MAX_SEARCH_DAYS; i++, date = date.plusDays(1)) {
            if (!firesOnDate(fields, date)) {
                continue;
            }
            LocalTime lowerBound = i == 0 ? earliest : LocalTime.MIDNIGHT;
            for (int h = lowerBound.getHour(); h < 24; h++) {
                if (!matchField(fields[HOUR], h)) {
                    continue;
                }
                int firstMinute = h == lowerBound.getHour() ? lowerBound.getMinute() : 0;
                for (int m = firstMinute; m < 60; m++) {
                    if (!matchField(fields[MINUTE], m)) {
                        continue;
                    }
                    ZonedDateTime candidate = ZonedDateTime.of(date, LocalTime.of(h, m), zone);
                    if (candidate.isAfter(from)) {
                        return Optional.of(candidate);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Builds the expression that fires once a day at {@code time}.
     */
    public static String dailyAt(LocalTime time) {
        Objects.requireNonNull(time, "time must not be null");
        return time.getMinute() + " " + time.getHour() + " * * *";
    }

    /**
     * Day-of-week index used by cron: 0 = Sunday ... 6 = Saturday.
     */
    public static int dayOfWeekIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }

    /**
     * Returns true if {@code cron} passes {@link #validate(String)}.
     */
    public static boolean isValid(String cron) {
        try {
            validate(cron);
            return true;
        } catch (IllegalArgumentException ex) {
            return false;
        }
    }

    /**
     * Checks that {@code cron} is a five-field expression made only of supported terms within field bounds.
     *
     * @throws IllegalArgumentException describing the first offending field
     */
    public static void validate(String cron) {
        if (cron == null || cron.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be blank");
        }
        String[] fields = WHITESPACE.split(cron.trim());
        if (fields.length != 5) {
            throw new IllegalArgumentException(
                    "Expected 5 fields (minute hour day-of-month month day-of-week) but got " + fields.length + ": " + cron);
        }
        for (int i = 0; i < fields.length; i++) {
            validateField(i, fields[i], cron);
        }
    }

    /* ================= helper ================= */

    private static String[] fields(String cron) {
        if (cron == null || cron.isBlank()) {
            return null;
        }
        String[] parts = WHITESPACE.split(cron.trim());
        return parts.length == 5 ? parts : null;
    }

    private static boolean firesOnDate(String[] fields, LocalDate date) {
        return matchField(fields[MONTH], date.getMonthValue())
                && matchField(fields[DAY_OF_MONTH], date.getDayOfMonth())
                && matchDayOfWeek(fields[DAY_OF_WEEK], dayOfWeekIndex(date));
    }

    private static boolean matchTerm(String term, int value) {
        if (term.startsWith("*/")) {
            String step = term.substring(2);
            if (!DIGITS.matcher(step).matches()) {
                return false;
            }
            int n = Integer.parseInt(step);
            return n > 0 && value % n == 0;
        }

        int dash = term.indexOf('-');
        if (dash > 0) {
            String lo = term.substring(0, dash);
            String hi = term.substring(dash + 1);
            if (!DIGITS.matcher(lo).matches() || !DIGITS.matcher(hi).matches()) {
                return false;
            }
            return value >= Integer.parseInt(lo) && value <= Integer.parseInt(hi);
        }

        return DIGITS.matcher(term).matches() && Integer.parseInt(term) == value;
    }

    private static void validateField(int index, String field, String cron) {
        if ("*".equals(field)) {
            return;
        }
        int min = BOUNDS[index][0];
        int max = BOUNDS[index][1];
        String name = FIELD_NAMES[index];

        for (String term : field.split(",", -1)) {
            if (term.startsWith("*/")) {
                String step = term.substring(2);
                if (!DIGITS.matcher(step).matches() || Integer.parseInt(step) < 1) {
                    throw invalidTerm(name, term, cron);
                }
                continue;
            }

            int dash = term.indexOf('-');
            if (dash > 0) {
                String lo = term.substring(0, dash);
                String hi = term.substring(dash + 1);
                if (!DIGITS.matcher(lo).matches() || !DIGITS.matcher(hi).matches()) {
                    throw invalidTerm(name, term, cron);
                }
                int start = Integer.parseInt(lo);
                int end = Integer.parseInt(hi);
                if (start < min || end > max || start > end) {
                    throw new IllegalArgumentException(
                            "Range " + term + " out of bounds " + min + "-" + max + " for " + name + " in: " + cron);
                }
                continue;
            }

            if (!DIGITS.matcher(term).matches()) {
                throw invalidTerm(name, term, cron);
            }
            int literal = Integer.parseInt(term);
            if (literal < min || literal > max) {
                throw new IllegalArgumentException(
                        "Value " + literal + " out of bounds " + min + "-" + max + " for " + name + " in: " + cron);
            }
        }
    }

    private static IllegalArgumentException invalidTerm(String fieldName, String term, String cron) {
        return new IllegalArgumentException("Unsupported " + fieldName + " term '" + term + "' in: " + cron);
    }
}
