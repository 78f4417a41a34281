package com.example.seasonroster.common;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Half-open clock window inside a single day, written {@code HH:mm-HH:mm} on the wire.
 */
public record TimeWindow(LocalTime start, LocalTime end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window needs both start and end");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Time window must end after it starts: " + start + "-" + end);
        }
    }

    public static TimeWindow of(String start, String end) {
        return new TimeWindow(parseTime(start), parseTime(end));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TimeWindow parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Time window is empty");
        }
        String[] parts = raw.split("-");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Time window must look like HH:mm-HH:mm: " + raw);
        }
        return of(parts[0].trim(), parts[1].trim());
    }

    /**
     * Parses {@code HH:mm} (or {@code HH:mm:ss}); malformed input surfaces as {@link IllegalArgumentException}.
     */
    public static LocalTime parseTime(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Time is empty");
        }
        try {
            return LocalTime.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid time: " + raw, e);
        }
    }

    public long minutes() {
        return ChronoUnit.MINUTES.between(start, end);
    }

    public boolean covers(TimeWindow other) {
        return !start.isAfter(other.start) && !end.isBefore(other.end);
    }

    @JsonValue
    public String label() {
        return timeLabel(start) + "-" + timeLabel(end);
    }

    @Override
    public String toString() {
        return label();
    }

    private static String timeLabel(LocalTime t) {
        return String.format("%02d:%02d", t.getHour(), t.getMinute());
    }
}
