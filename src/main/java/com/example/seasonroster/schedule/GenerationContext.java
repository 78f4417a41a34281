package com.example.seasonroster.schedule;

import com.example.seasonroster.breaks.BreakRules;
import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.config.RosterRules;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import com.example.seasonroster.history.HistoricalAggregates;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulated state of one generation call. Created per call and discarded with it.
 */
public final class GenerationContext {

    private static final double EPSILON = 1e-9;

    private final GenerateRosterRequest request;
    private final SeasonCalendar calendar;
    private final RosterRules rules;
    private final HistoricalAggregates history;
    private final Map<String, Employee> employeesById = new LinkedHashMap<>();
    private final Map<String, Set<LocalDate>> blackouts = new HashMap<>();
    private final Map<String, Set<LocalDate>> forcedOff = new HashMap<>();

    private final List<Assignment> assignments = new ArrayList<>();
    private final List<Violation> adHocConflicts = new ArrayList<>();
    private final Map<String, Map<LocalDate, Double>> dailyHours = new HashMap<>();
    private final Map<LocalDate, List<Assignment>> assignmentsByDay = new HashMap<>();

    public GenerationContext(GenerateRosterRequest request, SeasonCalendar calendar,
                             RosterRules rules, HistoricalAggregates history) {
        this.request = request;
        this.calendar = calendar;
        this.rules = rules;
        this.history = history == null ? HistoricalAggregates.empty() : history;
        for (Employee e : request.employees()) {
            employeesById.put(e.id(), e);
        }
        for (GenerateRosterRequest.Unavailability u : request.unavailability()) {
            blackouts.computeIfAbsent(u.employeeId(), k -> new HashSet<>()).add(u.date());
        }
    }

    public GenerateRosterRequest getRequest() { return request; }
    public SeasonCalendar getCalendar() { return calendar; }
    public RosterRules getRules() { return rules; }
    public HistoricalAggregates getHistory() { return history; }

    public boolean isShoulder() {
        return request.shoulderSeason();
    }

    public List<Employee> getEmployees() {
        return List.copyOf(employeesById.values());
    }

    public Employee employee(String id) {
        return employeesById.get(id);
    }

    public long countWithRole(Role role) {
        return employeesById.values().stream().filter(e -> e.role() == role).count();
    }

    public boolean isOpen(Location location, LocalDate date) {
        return switch (location) {
            case GREYSTONES, BOAT -> calendar.isGreystonesOpen(date);
            case BEACH_SHOP -> calendar.isBeachShopOpen(date);
        };
    }

    public TimeWindow windowFor(Location location) {
        return request.hours().windowFor(location);
    }

    // --- time off -------------------------------------------------------

    public boolean isBlackedOut(String employeeId, LocalDate date) {
        return blackouts.getOrDefault(employeeId, Set.of()).contains(date);
    }

    public boolean hasTimeOffInWeek(String employeeId, LocalDate weekStart) {
        LocalDate weekEnd = weekStart.plusDays(6);
        return blackouts.getOrDefault(employeeId, Set.of()).stream()
                .anyMatch(d -> !d.isBefore(weekStart) && !d.isAfter(weekEnd));
    }

    public void forceOff(String employeeId, LocalDate date) {
        forcedOff.computeIfAbsent(employeeId, k -> new HashSet<>()).add(date);
    }

    public boolean isForcedOff(String employeeId, LocalDate date) {
        return forcedOff.getOrDefault(employeeId, Set.of()).contains(date);
    }

    // --- assignments ----------------------------------------------------

    public Assignment assign(Employee employee, LocalDate date, Location location, TimeWindow window, Provenance provenance) {
        Assignment a = new Assignment(date, location, window, employee.id(), employee.name(), employee.role(), provenance);
        assignments.add(a);
        assignmentsByDay.computeIfAbsent(date, k -> new ArrayList<>()).add(a);
        dailyHours.computeIfAbsent(employee.id(), k -> new HashMap<>()).merge(date, a.paidHours(), Math::max);
        return a;
    }

    public void addAdHocConflict(Violation violation) {
        adHocConflicts.add(violation);
    }

    public List<Assignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    public List<Violation> getAdHocConflicts() {
        return Collections.unmodifiableList(adHocConflicts);
    }

    public List<Assignment> assignmentsOn(LocalDate date) {
        return assignmentsByDay.getOrDefault(date, List.of());
    }

    public boolean isAssigned(String employeeId, LocalDate date) {
        return assignmentsOn(date).stream().anyMatch(a -> a.employeeId().equals(employeeId));
    }

    public boolean isAssignedAt(String employeeId, LocalDate date, Location location) {
        return assignmentsOn(date).stream()
                .anyMatch(a -> a.employeeId().equals(employeeId) && a.location() == location);
    }

    public long countOn(LocalDate date, Location location, Role role) {
        return assignmentsOn(date).stream().filter(a -> a.location() == location && a.role() == role).count();
    }

    // --- hours ----------------------------------------------------------

    public double hoursOn(String employeeId, LocalDate date) {
        return dailyHours.getOrDefault(employeeId, Map.of()).getOrDefault(date, 0.0);
    }

    /** Hours this shift would add to the day, given the day counts its longest shift only. */
    public double incrementalHours(String employeeId, LocalDate date, TimeWindow window) {
        return Math.max(0.0, BreakRules.paidHours(window) - hoursOn(employeeId, date));
    }

    public double weekHours(String employeeId, LocalDate weekStart) {
        double total = 0.0;
        for (LocalDate d : calendar.daysOfWeek(weekStart)) {
            total += hoursOn(employeeId, d);
        }
        return total;
    }

    public double runHours(String employeeId) {
        return dailyHours.getOrDefault(employeeId, Map.of()).values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public boolean exceedsMax(Employee employee, double hours) {
        return hours > employee.maxHoursPerWeek() + EPSILON;
    }

    // --- worked days ----------------------------------------------------

    /** Run assignments inside the period, recorded history before it. */
    public boolean worked(String employeeId, LocalDate date) {
        if (calendar.contains(date)) {
            return isAssigned(employeeId, date);
        }
        if (date.isBefore(calendar.getStart())) {
            return history.workedDays(calendar.weekStartOf(date), employeeId).contains(date);
        }
        return false;
    }

    public boolean hasHistoryRecord(String employeeId, LocalDate date) {
        return history.hasWorkedDayRecord(calendar.weekStartOf(date), employeeId);
    }

    /** Length of the work run containing {@code date} if the employee also worked that day. */
    public int runLengthWith(String employeeId, LocalDate date) {
        int length = 1;
        for (LocalDate d = date.minusDays(1); worked(employeeId, d); d = d.minusDays(1)) {
            length++;
        }
        for (LocalDate d = date.plusDays(1); worked(employeeId, d); d = d.plusDays(1)) {
            length++;
        }
        return length;
    }

    public int daysWorkedInWeek(String employeeId, LocalDate weekStart) {
        int days = 0;
        for (LocalDate d : calendar.daysOfWeek(weekStart)) {
            if (isAssigned(employeeId, d)) {
                days++;
            }
        }
        return days;
    }

    public int leaderDaysInWeek(String employeeId, LocalDate weekStart) {
        int days = 0;
        for (LocalDate d : calendar.daysOfWeek(weekStart)) {
            boolean led = assignmentsOn(d).stream()
                    .anyMatch(a -> a.employeeId().equals(employeeId) && a.role() == Role.TEAM_LEADER);
            if (led) {
                days++;
            }
        }
        return days;
    }
}
