package com.example.seasonroster.history;

import com.example.seasonroster.employee.Role;
import com.example.seasonroster.schedule.Assignment;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only per-employee weekly summaries of previously finalized schedules.
 * Keys are (week start, employee id); a key present in {@code workedDays} means that
 * week is on record for the employee, even when the set is empty.
 */
public final class HistoricalAggregates {

    private static final HistoricalAggregates EMPTY = new HistoricalAggregates(Map.of(), Map.of(), Map.of());

    private final Map<HistoryKey, Double> weeklyHours;
    private final Map<HistoryKey, Integer> weeklyLeaderDays;
    private final Map<HistoryKey, Set<LocalDate>> weeklyWorkedDays;

    public HistoricalAggregates(Map<HistoryKey, Double> weeklyHours,
                                Map<HistoryKey, Integer> weeklyLeaderDays,
                                Map<HistoryKey, Set<LocalDate>> weeklyWorkedDays) {
        this.weeklyHours = Map.copyOf(weeklyHours);
        this.weeklyLeaderDays = Map.copyOf(weeklyLeaderDays);
        Map<HistoryKey, Set<LocalDate>> worked = new HashMap<>();
        weeklyWorkedDays.forEach((k, v) -> worked.put(k, Set.copyOf(v)));
        this.weeklyWorkedDays = Map.copyOf(worked);
    }

    public static HistoricalAggregates empty() {
        return EMPTY;
    }

    /**
     * Summarizes finalized assignments by the week grid starting on {@code weekStartDay}.
     * Hours per day take the longest shift; a leadership day is a day worked as team leader.
     */
    public static HistoricalAggregates fromFinalizedAssignments(Collection<Assignment> assignments, DayOfWeek weekStartDay) {
        Map<HistoryKey, Map<LocalDate, Double>> dailyHours = new HashMap<>();
        Map<HistoryKey, Set<LocalDate>> leaderDays = new HashMap<>();
        for (Assignment a : assignments) {
            LocalDate weekStart = a.date().with(TemporalAdjusters.previousOrSame(weekStartDay));
            HistoryKey key = new HistoryKey(weekStart, a.employeeId());
            dailyHours.computeIfAbsent(key, k -> new HashMap<>()).merge(a.date(), a.paidHours(), Math::max);
            if (a.role() == Role.TEAM_LEADER) {
                leaderDays.computeIfAbsent(key, k -> new HashSet<>()).add(a.date());
            }
        }
        Map<HistoryKey, Double> hours = new HashMap<>();
        Map<HistoryKey, Integer> leaders = new HashMap<>();
        Map<HistoryKey, Set<LocalDate>> worked = new HashMap<>();
        dailyHours.forEach((key, days) -> {
            hours.put(key, days.values().stream().mapToDouble(Double::doubleValue).sum());
            worked.put(key, new TreeSet<>(days.keySet()));
        });
        leaderDays.forEach((key, days) -> leaders.put(key, days.size()));
        return new HistoricalAggregates(hours, leaders, worked);
    }

    public double hours(LocalDate weekStart, String employeeId) {
        return weeklyHours.getOrDefault(new HistoryKey(weekStart, employeeId), 0.0);
    }

    public int leaderDays(LocalDate weekStart, String employeeId) {
        return weeklyLeaderDays.getOrDefault(new HistoryKey(weekStart, employeeId), 0);
    }

    public Set<LocalDate> workedDays(LocalDate weekStart, String employeeId) {
        return weeklyWorkedDays.getOrDefault(new HistoryKey(weekStart, employeeId), Set.of());
    }

    public boolean hasWorkedDayRecord(LocalDate weekStart, String employeeId) {
        return weeklyWorkedDays.containsKey(new HistoryKey(weekStart, employeeId));
    }

    public boolean isEmpty() {
        return weeklyHours.isEmpty() && weeklyLeaderDays.isEmpty() && weeklyWorkedDays.isEmpty();
    }
}
