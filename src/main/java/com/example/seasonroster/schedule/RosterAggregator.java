package com.example.seasonroster.schedule;

import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives totals and violations from a finished assignment set. Nothing here reads the
 * allocator's running counters.
 */
@Component
public class RosterAggregator {

    public RosterResult aggregate(GenerationContext ctx) {
        List<Assignment> assignments = new ArrayList<>(ctx.getAssignments());
        assignments.sort(Assignment.ROSTER_ORDER);
        Map<String, Map<LocalDate, List<Assignment>>> byEmployeeDay = assignments.stream()
                .collect(Collectors.groupingBy(Assignment::employeeId,
                        Collectors.groupingBy(Assignment::date)));

        List<EmployeeTotals> totals = new ArrayList<>();
        for (Employee e : ctx.getEmployees()) {
            totals.add(totalsFor(ctx, e, byEmployeeDay.getOrDefault(e.id(), Map.of())));
        }

        List<Violation> violations = new ArrayList<>(ctx.getAdHocConflicts());
        coverageViolations(ctx, assignments, violations);
        managerViolations(ctx, byEmployeeDay, violations);
        hourViolations(ctx, totals, violations);
        violations.sort(Violation.REPORT_ORDER);

        SeasonCalendar calendar = ctx.getCalendar();
        return new RosterResult(calendar.getStart(), calendar.getEnd(),
                List.copyOf(assignments), List.copyOf(totals), List.copyOf(violations));
    }

    private EmployeeTotals totalsFor(GenerationContext ctx, Employee e, Map<LocalDate, List<Assignment>> byDay) {
        SeasonCalendar calendar = ctx.getCalendar();
        List<WeekTotals> weeks = new ArrayList<>();
        double totalHours = 0.0;
        int totalWeekendDays = 0;
        List<LocalDate> weekStarts = calendar.getWeekStarts();
        for (int w = 0; w < weekStarts.size(); w++) {
            double hours = 0.0;
            double days = 0.0;
            int weekendDays = 0;
            for (LocalDate d : calendar.daysOfWeek(weekStarts.get(w))) {
                List<Assignment> entries = byDay.get(d);
                if (entries == null || entries.isEmpty()) {
                    continue;
                }
                hours += entries.stream().mapToDouble(Assignment::paidHours).max().orElse(0.0);
                boolean beachOnly = entries.stream().allMatch(a -> a.location() == Location.BEACH_SHOP);
                days += beachOnly ? 0.5 : 1.0;
                if (SeasonCalendar.isWeekend(d)) {
                    weekendDays++;
                }
            }
            weeks.add(new WeekTotals(w, weekStarts.get(w), round(hours), days, weekendDays));
            totalHours += hours;
            totalWeekendDays += weekendDays;
        }
        Map<Location, Integer> locationCounts = new EnumMap<>(Location.class);
        for (Location location : Location.values()) {
            locationCounts.put(location, 0);
        }
        byDay.values().forEach(entries -> entries.forEach(a -> locationCounts.merge(a.location(), 1, Integer::sum)));
        return new EmployeeTotals(e.id(), e.name(), e.role(), List.copyOf(weeks), round(totalHours),
                totalWeekendDays, locationCounts);
    }

    private void coverageViolations(GenerationContext ctx, List<Assignment> assignments, List<Violation> out) {
        GenerateRosterRequest request = ctx.getRequest();
        Map<LocalDate, List<Assignment>> byDay = assignments.stream().collect(Collectors.groupingBy(Assignment::date));
        boolean captainOnRoster = ctx.countWithRole(Role.BOAT_CAPTAIN) > 0;
        for (LocalDate day : ctx.getCalendar().getDays()) {
            if (!ctx.isOpen(Location.GREYSTONES, day)) {
                continue;
            }
            List<Assignment> today = byDay.getOrDefault(day, List.of());
            long managers = count(today, Location.GREYSTONES, Set.of(Role.STORE_MANAGER));
            long leaders = count(today, Location.GREYSTONES, Set.of(Role.TEAM_LEADER));
            long floor = today.stream().filter(a -> a.location() == Location.GREYSTONES && a.role().isFloorRole()).count();

            if (ctx.isShoulder() && managers == 0) {
                out.add(new Violation(day, ViolationType.LEADER_GAP, "No Store Manager scheduled"));
            }
            int leadersNeeded = request.leadershipRules().teamLeadersNeeded(managers > 0);
            if (leaders < leadersNeeded) {
                out.add(new Violation(day, ViolationType.LEADER_GAP,
                        "Minimum team leader requirement not met (" + leaders + " of " + leadersNeeded + ")"));
            }
            int floorTarget = request.coverage().floorTarget(day);
            if (floor < floorTarget) {
                out.add(new Violation(day, ViolationType.COVERAGE_GAP,
                        "Greystones staffing below required level (" + floor + " of " + floorTarget + ")"));
            }
            if (count(today, Location.BOAT, Set.of(Role.BOAT_CAPTAIN)) == 0) {
                out.add(new Violation(day, ViolationType.ROLE_MISSING,
                        captainOnRoster ? "No Boat Captain available" : "No Boat Captain on the roster"));
            }
            if (ctx.isOpen(Location.BEACH_SHOP, day)) {
                long beach = today.stream().filter(a -> a.location() == Location.BEACH_SHOP).count();
                int needed = request.coverage().beachShopStaff();
                if (beach < needed) {
                    out.add(new Violation(day, ViolationType.BEACH_SHOP_GAP,
                            "Beach Shop staffing below required level (" + beach + " of " + needed + ")"));
                }
            }
        }
    }

    private void managerViolations(GenerationContext ctx, Map<String, Map<LocalDate, List<Assignment>>> byEmployeeDay,
                                   List<Violation> out) {
        SeasonCalendar calendar = ctx.getCalendar();
        GenerateRosterRequest request = ctx.getRequest();
        int cap = ctx.getRules().getManagerMaxDaysPerWeek();
        for (Employee manager : ctx.getEmployees()) {
            if (manager.role() != Role.STORE_MANAGER) {
                continue;
            }
            Map<LocalDate, List<Assignment>> worked = byEmployeeDay.getOrDefault(manager.id(), Map.of());
            for (LocalDate weekStart : calendar.getWeekStarts()) {
                List<LocalDate> days = calendar.daysOfWeek(weekStart);
                List<LocalDate> openDays = calendar.openDaysOfWeek(weekStart);
                if (openDays.isEmpty()) {
                    continue;
                }
                if (request.leadershipRules().managerTwoConsecutiveDaysOffPerWeek() && openDays.size() == 7
                        && !hasConsecutiveOffPair(days, worked)) {
                    out.add(new Violation(weekStart, ViolationType.MANAGER_CONSECUTIVE_DAYS_OFF,
                            manager.name() + " has no two consecutive days off"));
                }
                long forced = openDays.stream().filter(d -> ctx.isForcedOff(manager.id(), d)).count();
                long timeOff = openDays.stream().filter(d -> ctx.isBlackedOut(manager.id(), d)).count();
                long expected = ctx.isShoulder() ? openDays.size() : Math.min(cap, openDays.size() - forced);
                expected = Math.max(0, expected - timeOff);
                long actual = openDays.stream().filter(worked::containsKey).count();
                if (actual < expected) {
                    out.add(new Violation(weekStart, ViolationType.MANAGER_EXPECTED_DAYS,
                            manager.name() + " scheduled " + actual + " days, expected " + expected));
                }
            }
        }
    }

    private void hourViolations(GenerationContext ctx, List<EmployeeTotals> totals, List<Violation> out) {
        SeasonCalendar calendar = ctx.getCalendar();
        Map<String, Employee> byId = new HashMap<>();
        ctx.getEmployees().forEach(e -> byId.put(e.id(), e));
        for (EmployeeTotals t : totals) {
            Employee e = byId.get(t.employeeId());
            for (WeekTotals week : t.weeks()) {
                if (ctx.exceedsMax(e, week.hours())) {
                    out.add(new Violation(week.weekStart(), ViolationType.HOURS_MAX_VIOLATION,
                            e.name() + " scheduled " + format(week.hours()) + "h, maximum is "
                                    + format(e.maxHoursPerWeek()) + "h"));
                }
                boolean minWaived = ctx.isShoulder()
                        || ctx.hasTimeOffInWeek(e.id(), week.weekStart())
                        || calendar.openDaysOfWeek(week.weekStart()).isEmpty();
                if (!minWaived && week.hours() + 1e-9 < e.minHoursPerWeek()) {
                    out.add(new Violation(week.weekStart(), ViolationType.HOURS_MIN_VIOLATION,
                            e.name() + " scheduled " + format(week.hours()) + "h, minimum is "
                                    + format(e.minHoursPerWeek()) + "h"));
                }
            }
        }
    }

    private static boolean hasConsecutiveOffPair(List<LocalDate> days, Map<LocalDate, List<Assignment>> worked) {
        for (int i = 0; i < days.size() - 1; i++) {
            if (!worked.containsKey(days.get(i)) && !worked.containsKey(days.get(i + 1))) {
                return true;
            }
        }
        return false;
    }

    private static long count(List<Assignment> day, Location location, Set<Role> roles) {
        return day.stream().filter(a -> a.location() == location && roles.contains(a.role())).count();
    }

    private static double round(double hours) {
        return Math.round(hours * 100.0) / 100.0;
    }

    static String format(double hours) {
        return BigDecimal.valueOf(round(hours)).stripTrailingZeros().toPlainString();
    }
}
