package com.example.seasonroster.schedule;

import java.time.LocalDate;
import java.util.List;

public record RosterResult(
        LocalDate periodStart,
        LocalDate periodEnd,
        List<Assignment> assignments,
        List<EmployeeTotals> totals,
        List<Violation> violations) {

    public List<Violation> violationsOf(ViolationType type) {
        return violations.stream().filter(v -> v.type() == type).toList();
    }

    public List<Assignment> assignmentsOn(LocalDate date) {
        return assignments.stream().filter(a -> a.date().equals(date)).toList();
    }

    public EmployeeTotals totalsFor(String employeeId) {
        return totals.stream().filter(t -> t.employeeId().equals(employeeId)).findFirst().orElse(null);
    }
}
