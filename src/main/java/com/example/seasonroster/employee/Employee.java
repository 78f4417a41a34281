package com.example.seasonroster.employee;

import com.example.seasonroster.common.TimeWindow;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Roster member as supplied by the caller. Immutable for the duration of one generation call.
 */
public record Employee(
        @NotBlank(message = "Employee id is required") String id,
        @NotBlank(message = "Employee name is required")
        @Size(max = 120, message = "Employee name must be at most 120 characters") String name,
        @NotNull(message = "Role is required") Role role,
        @PositiveOrZero double minHoursPerWeek,
        @PositiveOrZero double maxHoursPerWeek,
        PriorityTier priorityTier,
        boolean student,
        Map<DayOfWeek, List<TimeWindow>> availability) {

    public Employee {
        priorityTier = priorityTier == null ? PriorityTier.B : priorityTier;
        Map<DayOfWeek, List<TimeWindow>> copy = new EnumMap<>(DayOfWeek.class);
        if (availability != null) {
            availability.forEach((day, windows) -> copy.put(day, windows == null ? List.of() : List.copyOf(windows)));
        }
        availability = Map.copyOf(copy);
    }

    /**
     * True when one of the employee's windows for that weekday fully covers the requested window.
     */
    public boolean isAvailable(LocalDate date, TimeWindow requested) {
        List<TimeWindow> windows = availability.getOrDefault(date.getDayOfWeek(), List.of());
        for (TimeWindow window : windows) {
            if (window.covers(requested)) {
                return true;
            }
        }
        return false;
    }
}
