package com.example.seasonroster.schedule;

import com.example.seasonroster.employee.Role;

import java.util.List;
import java.util.Map;

public record EmployeeTotals(
        String employeeId,
        String name,
        Role role,
        List<WeekTotals> weeks,
        double totalHours,
        int weekendDays,
        Map<Location, Integer> locationCounts) {

    public WeekTotals week(int index) {
        return weeks.get(index);
    }
}
