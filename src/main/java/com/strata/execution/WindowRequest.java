package com.strata.execution;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Body of a window change: the daily window plus optional per-day overrides,
 * e.g. {@code {"window": "22:00-06:00", "by_day": {"saturday": "ALWAYS"}}}.
 */
public class WindowRequest {

    @JsonProperty("window")
    private String window;

    @JsonProperty("by_day")
    private Map<String, String> byDay;

    public WindowRequest() {
    }

    public WindowRequest(String window, Map<String, String> byDay) {
        this.window = window;
        this.byDay = byDay;
    }

    public ExecutionWindow toWindow() {
        if (window == null || window.isBlank()) {
            throw new IllegalArgumentException("window is required");
        }
        Map<DayOfWeek, String> overrides = new EnumMap<>(DayOfWeek.class);
        if (byDay != null) {
            byDay.forEach((day, spec) -> overrides.put(DayOfWeek.valueOf(day.toUpperCase(Locale.ROOT)), spec));
        }
        return ExecutionWindow.parse(window, overrides);
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }

    public Map<String, String> getByDay() {
        return byDay;
    }

    public void setByDay(Map<String, String> byDay) {
        this.byDay = byDay;
    }
}
