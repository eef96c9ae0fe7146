package seakers.micscheduler.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.util.Collections;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class WorkingCalendarTest {

    // 2024-01-01 is a Monday
    private final WorkingCalendar calendar = WorkingCalendar.standard(LocalDate.of(2024, 1, 1));

    @Test
    @DisplayName("standard calendar works 08:00-12:00 and 13:00-17:00")
    void standardWindows() {
        assertTrue(calendar.isWorkingHour(0));
        assertTrue(calendar.isWorkingHour(3));
        assertFalse(calendar.isWorkingHour(4));
        assertTrue(calendar.isWorkingHour(5));
        assertTrue(calendar.isWorkingHour(8));
        assertFalse(calendar.isWorkingHour(9));
        assertEquals(8, calendar.getHoursPerDay());
    }

    @Test
    @DisplayName("lunch break lengthens a job but is not occupied")
    void lunchBreakSkipped() {
        assertArrayEquals(new int[]{0, 1, 2, 3, 5}, calendar.workingSlots(0, 5));
        assertEquals(9, calendar.addWorkingHours(0, 8));
        assertEquals(5, calendar.nextWorkingHour(4));
    }

    @Test
    @DisplayName("Sundays are rest days")
    void sundayOff() {
        int sundayMorning = 6 * 24;
        assertFalse(calendar.isWorkingHour(sundayMorning));
        assertEquals(7 * 24, calendar.nextWorkingHour(sundayMorning));
        assertEquals(8 * 6, calendar.workingHoursBetween(0, 7 * 24));
    }

    @Test
    @DisplayName("hours map back to dates and months")
    void dateMapping() {
        assertEquals(LocalDateTime.of(2024, 1, 2, 8, 0), calendar.dateTimeAt(24));
        assertEquals(24, calendar.hourOf(LocalDateTime.of(2024, 1, 2, 8, 30)));
        assertEquals(Month.JANUARY, calendar.monthAt(0));
        assertEquals(Month.FEBRUARY, calendar.monthAt(31 * 24));
    }

    @Test
    @DisplayName("hours beyond the tabulated span are still answered")
    void beyondSpan() {
        int late = WorkingCalendar.DEFAULT_SPAN_HOURS + 24 * 3;
        assertEquals(calendar.dateTimeAt(late).getMonth(), calendar.monthAt(late));
        assertTrue(calendar.isWorkingHour(calendar.nextWorkingHour(late)));
    }

    @Test
    @DisplayName("continuous calendar counts every hour")
    void continuous() {
        WorkingCalendar continuous = WorkingCalendar.continuous(LocalDateTime.of(2024, 1, 7, 0, 0));
        assertTrue(continuous.isWorkingHour(0));
        assertEquals(8, continuous.addWorkingHours(3, 5));
        assertEquals(24, continuous.getHoursPerDay());
    }

    @Test
    @DisplayName("a calendar without working hours is rejected")
    void emptyCalendarRejected() {
        assertThrows(IllegalArgumentException.class, () -> new WorkingCalendar(LocalDateTime.of(2024, 1, 1, 0, 0),
                Collections.singletonList(new int[]{12, 8}), EnumSet.noneOf(DayOfWeek.class), 24));
    }
}
