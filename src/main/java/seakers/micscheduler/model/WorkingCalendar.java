package seakers.micscheduler.model;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Legal working time of the project. Hour index {@code t} denotes the slot {@code [origin + t h, origin + t h + 1 h)}.
 *
 * Working flags and months are tabulated for the first {@code spanHours} hours so that the decoder's
 * hot loop never touches {@link LocalDateTime}; later hours are computed on demand.
 */
public class WorkingCalendar {

    public static final int DEFAULT_SPAN_HOURS = 2 * 366 * 24;

    private final LocalDateTime origin;
    private final List<int[]> dailyWindows;
    private final Set<DayOfWeek> restDays;
    private final boolean[] working;
    private final byte[] months;
    private final int hoursPerDay;

    public WorkingCalendar(LocalDateTime origin, List<int[]> dailyWindows, Set<DayOfWeek> restDays, int spanHours) {
        this.origin = origin.truncatedTo(ChronoUnit.HOURS);
        this.dailyWindows = new ArrayList<>();
        int hours = 0;
        for (int[] window : dailyWindows) {
            if (window.length != 2 || window[0] < 0 || window[1] > 24 || window[0] >= window[1]) {
                throw new IllegalArgumentException("Invalid working window: " + window[0] + "-" + window[1]);
            }
            this.dailyWindows.add(new int[]{window[0], window[1]});
            hours += window[1] - window[0];
        }
        this.hoursPerDay = hours;
        this.restDays = restDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(restDays);
        if (hours == 0 || this.restDays.size() == DayOfWeek.values().length) {
            throw new IllegalArgumentException("Calendar has no working hours");
        }

        this.working = new boolean[spanHours];
        this.months = new byte[spanHours];
        LocalDateTime current = this.origin;
        for (int t = 0; t < spanHours; t++) {
            this.working[t] = computeWorking(current);
            this.months[t] = (byte) current.getMonthValue();
            current = current.plusHours(1);
        }
    }

    /**
     * Site calendar: 08:00-12:00 and 13:00-17:00, Sundays off
     */
    public static WorkingCalendar standard(LocalDate startDate) {
        List<int[]> windows = new ArrayList<>();
        windows.add(new int[]{8, 12});
        windows.add(new int[]{13, 17});
        return new WorkingCalendar(startDate.atTime(8, 0), windows, EnumSet.of(DayOfWeek.SUNDAY), DEFAULT_SPAN_HOURS);
    }

    /**
     * Round-the-clock calendar, mainly for simulations where elapsed time equals working time
     */
    public static WorkingCalendar continuous(LocalDateTime origin) {
        return new WorkingCalendar(origin, Collections.singletonList(new int[]{0, 24}), EnumSet.noneOf(DayOfWeek.class), DEFAULT_SPAN_HOURS);
    }

    private boolean computeWorking(LocalDateTime dateTime) {
        if (this.restDays.contains(dateTime.getDayOfWeek())) {
            return false;
        }
        int hour = dateTime.getHour();
        for (int[] window : this.dailyWindows) {
            if (hour >= window[0] && hour < window[1]) {
                return true;
            }
        }
        return false;
    }

    public boolean isWorkingHour(int t) {
        if (t < 0) {
            return false;
        }
        if (t < this.working.length) {
            return this.working[t];
        }
        return computeWorking(dateTimeAt(t));
    }

    public int nextWorkingHour(int t) {
        int current = Math.max(0, t);
        while (!isWorkingHour(current)) {
            current++;
        }
        return current;
    }

    /**
     * @return the end (exclusive) of a job of {@code hours} working hours whose first slot is the first working hour at or after {@code start}
     */
    public int addWorkingHours(int start, int hours) {
        if (hours <= 0) {
            return start;
        }
        int current = nextWorkingHour(start);
        int counted = 1;
        while (counted < hours) {
            current = nextWorkingHour(current + 1);
            counted++;
        }
        return current + 1;
    }

    /**
     * Hour indices a job of {@code hours} working hours occupies when it starts at the first working hour at or after {@code start}
     */
    public int[] workingSlots(int start, int hours) {
        int[] slots = new int[Math.max(0, hours)];
        int current = start;
        for (int i = 0; i < slots.length; i++) {
            current = nextWorkingHour(current);
            slots[i] = current;
            current++;
        }
        return slots;
    }

    public int workingHoursBetween(int from, int to) {
        int count = 0;
        for (int t = Math.max(0, from); t < to; t++) {
            if (isWorkingHour(t)) {
                count++;
            }
        }
        return count;
    }

    public LocalDateTime dateTimeAt(int t) {
        return this.origin.plusHours(t);
    }

    public Month monthAt(int t) {
        if (t >= 0 && t < this.months.length) {
            return Month.of(this.months[t]);
        }
        return dateTimeAt(t).getMonth();
    }

    public int hourOf(LocalDateTime dateTime) {
        return (int) Duration.between(this.origin, dateTime.truncatedTo(ChronoUnit.HOURS)).toHours();
    }

    public LocalDateTime getOrigin() {
        return this.origin;
    }

    public int getHoursPerDay() {
        return this.hoursPerDay;
    }
}
