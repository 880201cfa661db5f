package com.strata.execution;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Weekly schedule of when new actions may start.
 *
 * <p>Each day carries one window: {@code ALWAYS}, {@code NEVER} or {@code HH:MM-HH:MM}.
 * A window whose end is before its start runs past midnight into the next day, so
 * {@code 22:00-06:00} on Monday also admits Tuesday 05:59. Equal start and end mean the whole day.
 */
public final class ExecutionWindow {

    private static final Pattern RANGE = Pattern.compile("^\\s*(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})\\s*$");

    private final Map<DayOfWeek, DailyWindow> days;

    private ExecutionWindow(Map<DayOfWeek, DailyWindow> days) {
        this.days = Collections.unmodifiableMap(new EnumMap<>(days));
    }

    public static ExecutionWindow always() {
        return everyDay(DailyWindow.ALWAYS);
    }

    public static ExecutionWindow never() {
        return everyDay(DailyWindow.NEVER);
    }

    /**
     * Same window every day.
     */
    public static ExecutionWindow parse(String spec) {
        return everyDay(DailyWindow.parse(spec));
    }

    /**
     * @param overrides per-day windows replacing the default, may be empty
     */
    public static ExecutionWindow parse(String defaultSpec, Map<DayOfWeek, String> overrides) {
        DailyWindow fallback = DailyWindow.parse(defaultSpec);
        Map<DayOfWeek, DailyWindow> days = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            String override = overrides.get(day);
            days.put(day, override == null || override.isBlank() ? fallback : DailyWindow.parse(override));
        }
        return new ExecutionWindow(days);
    }

    private static ExecutionWindow everyDay(DailyWindow window) {
        Map<DayOfWeek, DailyWindow> days = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            days.put(day, window);
        }
        return new ExecutionWindow(days);
    }

    public ExecutionWindow withDay(DayOfWeek day, String spec) {
        Map<DayOfWeek, DailyWindow> copy = new EnumMap<>(days);
        copy.put(day, DailyWindow.parse(spec));
        return new ExecutionWindow(copy);
    }

    public boolean isOpen(LocalDateTime at) {
        LocalTime time = at.toLocalTime();
        if (days.get(at.getDayOfWeek()).admitsSameDay(time)) {
            return true;
        }
        DailyWindow yesterday = days.get(at.getDayOfWeek().minus(1));
        return yesterday.isOvernight() && time.isBefore(yesterday.end);
    }

    public DailyWindow day(DayOfWeek day) {
        return days.get(day);
    }

    /**
     * Single definition when every day is the same, otherwise one entry per day.
     */
    public String describe() {
        DailyWindow monday = days.get(DayOfWeek.MONDAY);
        if (days.values().stream().allMatch(monday::equals)) {
            return monday.toString();
        }
        StringBuilder sb = new StringBuilder();
        for (DayOfWeek day : DayOfWeek.values()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(day).append('=').append(days.get(day));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return days.equals(((ExecutionWindow) o).days);
    }

    @Override
    public int hashCode() {
        return days.hashCode();
    }

    @Override
    public String toString() {
        return describe();
    }

    /**
     * Window of a single day.
     */
    public static final class DailyWindow {

        static final DailyWindow ALWAYS = new DailyWindow(null, null, true);
        static final DailyWindow NEVER = new DailyWindow(null, null, false);

        private final LocalTime start;
        private final LocalTime end;
        private final boolean open;

        private DailyWindow(LocalTime start, LocalTime end, boolean open) {
            this.start = start;
            this.end = end;
            this.open = open;
        }

        static DailyWindow parse(String spec) {
            if (spec == null || spec.isBlank()) {
                throw new IllegalArgumentException("Execution window must not be empty");
            }
            String trimmed = spec.trim();
            if ("ALWAYS".equalsIgnoreCase(trimmed)) {
                return ALWAYS;
            }
            if ("NEVER".equalsIgnoreCase(trimmed)) {
                return NEVER;
            }
            Matcher matcher = RANGE.matcher(trimmed);
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Execution window '" + spec + "' is not HH:MM-HH:MM, ALWAYS or NEVER");
            }
            try {
                LocalTime start = LocalTime.parse(pad(matcher.group(1)));
                LocalTime end = LocalTime.parse(pad(matcher.group(2)));
                if (start.equals(end)) {
                    return ALWAYS;
                }
                return new DailyWindow(start, end, true);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Execution window '" + spec + "' has an invalid time", e);
            }
        }

        private static String pad(String time) {
            return time.length() == 4 ? "0" + time : time;
        }

        boolean isOvernight() {
            return start != null && end.isBefore(start);
        }

        boolean admitsSameDay(LocalTime time) {
            if (start == null) {
                return open;
            }
            if (isOvernight()) {
                return !time.isBefore(start);
            }
            return !time.isBefore(start) && time.isBefore(end);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            DailyWindow that = (DailyWindow) o;
            return open == that.open && Objects.equals(start, that.start) && Objects.equals(end, that.end);
        }

        @Override
        public int hashCode() {
            return Objects.hash(start, end, open);
        }

        @Override
        public String toString() {
            if (start == null) {
                return open ? "ALWAYS" : "NEVER";
            }
            return start + "-" + end;
        }
    }
}
