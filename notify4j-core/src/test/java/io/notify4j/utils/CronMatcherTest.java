package io.notify4j.utils;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronMatcherTest {

    private static final ZoneOffset KST = ZoneOffset.ofHours(9);

    // 2026-01-07 is a Wednesday, 2026-01-10 a Saturday, 2026-01-11 a Sunday
    private static final LocalDate WEDNESDAY = LocalDate.of(2026, 1, 7);
    private static final LocalDate SATURDAY = LocalDate.of(2026, 1, 10);
    private static final LocalDate SUNDAY = LocalDate.of(2026, 1, 11);

    @Test
    void matchFieldShouldSupportWildcardRangeListAndStep() {
        assertTrue(CronMatcher.matchField("*", 42));
        assertTrue(CronMatcher.matchField("1-5", 3));
        assertFalse(CronMatcher.matchField("1-5", 6));
        assertTrue(CronMatcher.matchField("1,3,5", 3));
        assertFalse(CronMatcher.matchField("1,3,5", 4));
        assertTrue(CronMatcher.matchField("*/15", 30));
        assertFalse(CronMatcher.matchField("*/15", 31));
        assertTrue(CronMatcher.matchField("1-3,10", 10));
    }

    @Test
    void matchFieldShouldRejectMalformedTerms() {
        assertFalse(CronMatcher.matchField("abc", 1));
        assertFalse(CronMatcher.matchField("*/0", 0));
        assertFalse(CronMatcher.matchField("1-", 1));
        assertFalse(CronMatcher.matchField(null, 1));
    }

    @Test
    void matchDayOfWeekShouldTreatSevenAsSunday() {
        assertTrue(CronMatcher.matchDayOfWeek("0", 0));
        assertTrue(CronMatcher.matchDayOfWeek("7", 0));
        assertTrue(CronMatcher.matchDayOfWeek("5-7", 0));
        assertFalse(CronMatcher.matchDayOfWeek("7", 6));
        assertFalse(CronMatcher.matchDayOfWeek("1-5", 0));
    }

    @Test
    void firesOnDateShouldFollowWeekdayRange() {
        assertTrue(CronMatcher.firesOnDate("0 9 * * 1-5", WEDNESDAY));
        assertFalse(CronMatcher.firesOnDate("0 9 * * 1-5", SATURDAY));
        assertTrue(CronMatcher.firesOnDate("30 7 * * 7", SUNDAY));
    }

    @Test
    void firesOnDateShouldRequireDayOfMonthAndDayOfWeek() {
        // 15th of January 2026 is a Thursday
        assertTrue(CronMatcher.firesOnDate("0 9 15 1 4", LocalDate.of(2026, 1, 15)));
        assertFalse(CronMatcher.firesOnDate("0 9 15 1 1", LocalDate.of(2026, 1, 15)));
        assertFalse(CronMatcher.firesOnDate("0 9 15 2 *", LocalDate.of(2026, 1, 15)));
    }

    @Test
    void firesOnDateShouldBeFalseForWrongFieldCount() {
        assertFalse(CronMatcher.firesOnDate("0 9 * *", WEDNESDAY));
        assertFalse(CronMatcher.firesOnDate("0 0 9 * * *", WEDNESDAY));
        assertFalse(CronMatcher.firesOnDate("", WEDNESDAY));
    }

    @Test
    void firstFireOnShouldReturnEarliestMatchingTime() {
        assertEquals(Optional.of(LocalTime.of(9, 0)), CronMatcher.firstFireOn("0 9,18 * * *", WEDNESDAY));
        assertEquals(Optional.of(LocalTime.of(0, 0)), CronMatcher.firstFireOn("*/30 * * * *", WEDNESDAY));
        assertEquals(Optional.empty(), CronMatcher.firstFireOn("0 9 * * 1-5", SATURDAY));
    }

    @Test
    void nextFireAfterShouldBeStrictlyAfterStart() {
        ZonedDateTime from = ZonedDateTime.of(2026, 1, 7, 9, 0, 0, 0, KST);

        ZonedDateTime next = CronMatcher.nextFireAfter("0 9 * * 1-5", from).orElseThrow();

        assertEquals(ZonedDateTime.of(2026, 1, 8, 9, 0, 0, 0, KST), next);
    }

    @Test
    void nextFireAfterShouldSkipWeekend() {
        ZonedDateTime fridayEvening = ZonedDateTime.of(2026, 1, 9, 18, 30, 0, 0, KST);

        ZonedDateTime next = CronMatcher.nextFireAfter("0 9 * * 1-5", fridayEvening).orElseThrow();

        assertEquals(ZonedDateTime.of(2026, 1, 12, 9, 0, 0, 0, KST), next);
    }

    @Test
    void nextFireAfterShouldRespectStepMinutes() {
        ZonedDateTime from = ZonedDateTime.of(2026, 1, 1, 0, 1, 20, 0, ZoneOffset.UTC);

        ZonedDateTime next = CronMatcher.nextFireAfter("*/5 * * * *", from).orElseThrow();

        assertEquals(ZonedDateTime.of(2026, 1, 1, 0, 5, 0, 0, ZoneOffset.UTC), next);
    }

    @Test
    void nextFireAfterShouldFindLeapDay() {
        ZonedDateTime from = ZonedDateTime.of(2026, 3, 1, 0, 0, 0, 0, KST);

        ZonedDateTime next = CronMatcher.nextFireAfter("0 0 29 2 *", from).orElseThrow();

        assertEquals(LocalDate.of(2028, 2, 29), next.toLocalDate());
    }

    @Test
    void nextFireAfterShouldBeEmptyWhenNeverFiring() {
        ZonedDateTime from = ZonedDateTime.of(2026, 1, 1, 0, 0, 0, 0, KST);

        assertTrue(CronMatcher.nextFireAfter("0 0 31 2 *", from).isEmpty());
    }

    @Test
    void dailyAtShouldBuildMinuteHourExpression() {
        assertEquals("0 8 * * *", CronMatcher.dailyAt(LocalTime.of(8, 0)));
        assertEquals("45 23 * * *", CronMatcher.dailyAt(LocalTime.of(23, 45)));
    }

    @Test
    void validateShouldAcceptSupportedSyntax() {
        CronMatcher.validate("0 9 * * 1-5");
        CronMatcher.validate("*/10 8-18 1,15 * 0,7");
        assertTrue(CronMatcher.isValid("59 23 31 12 7"));
    }

    @Test
    void validateShouldRejectUnsupportedOrOutOfRangeTerms() {
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 9 * *"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 0 9 * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("60 9 * * *"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 9 * JAN *"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 9 L * *"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 9 * * 5-1"));
        assertThrows(IllegalArgumentException.class, () -> CronMatcher.validate("0 9 * * 1,"));
        assertFalse(CronMatcher.isValid(null));
    }
}
