package com.example.seasonroster.schedule;

import com.example.seasonroster.breaks.BreakRules;
import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Role;

import java.time.LocalDate;
import java.util.Comparator;

/**
 * One shift of one employee at one location.
 */
public record Assignment(
        LocalDate date,
        Location location,
        TimeWindow window,
        String employeeId,
        String employeeName,
        Role role,
        Provenance provenance) {

    public static final Comparator<Assignment> ROSTER_ORDER = Comparator
            .comparing(Assignment::date)
            .thenComparing(a -> a.location().getDisplayName())
            .thenComparing(Assignment::employeeName)
            .thenComparing(a -> a.window().start())
            .thenComparing(Assignment::employeeId);

    public double paidHours() {
        return BreakRules.paidHours(window);
    }
}
