package com.example.seasonroster.schedule;

import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Decides who may legally take a shift. Ordering is left to {@link FairnessComparator}.
 */
@Component
public class EligibilityFilter {

    private final FairnessComparator fairness;

    public EligibilityFilter(FairnessComparator fairness) {
        this.fairness = fairness;
    }

    /**
     * Eligible employees of {@code role} for the window on {@code day}, best candidate first.
     */
    public List<Employee> eligible(GenerationContext ctx, LocalDate day, Role role, TimeWindow window,
                                   boolean ignoreMax, boolean allowDoubleBooking) {
        List<Employee> candidates = ctx.getEmployees().stream()
                .filter(e -> e.role() == role)
                .filter(e -> isEligible(ctx, e, day, window, ignoreMax, allowDoubleBooking))
                .toList();
        return fairness.order(ctx, day, role, window, candidates);
    }

    public boolean isEligible(GenerationContext ctx, Employee e, LocalDate day, TimeWindow window,
                              boolean ignoreMax, boolean allowDoubleBooking) {
        if (ctx.isBlackedOut(e.id(), day)) {
            return false;
        }
        if (!allowDoubleBooking && ctx.isAssigned(e.id(), day)) {
            return false;
        }
        if (e.role() == Role.STORE_MANAGER && ctx.isForcedOff(e.id(), day)) {
            return false;
        }
        if (ctx.isShoulder() && e.student() && !SeasonCalendar.isWeekend(day)) {
            return false;
        }
        if (exceedsConsecutiveCap(ctx, e, day)) {
            return false;
        }
        LocalDate weekStart = ctx.getCalendar().weekStartOf(day);
        if (e.role() == Role.STORE_MANAGER && !ctx.isShoulder() && !ctx.isAssigned(e.id(), day)
                && ctx.daysWorkedInWeek(e.id(), weekStart) >= ctx.getRules().getManagerMaxDaysPerWeek()) {
            return false;
        }
        if (!ignoreMax) {
            double projected = ctx.weekHours(e.id(), weekStart) + ctx.incrementalHours(e.id(), day, window);
            if (ctx.exceedsMax(e, projected)) {
                return false;
            }
        }
        return e.isAvailable(day, window);
    }

    public boolean exceedsConsecutiveCap(GenerationContext ctx, Employee e, LocalDate day) {
        if (ctx.isAssigned(e.id(), day)) {
            return false;
        }
        return ctx.runLengthWith(e.id(), day) > ctx.getRules().getMaxConsecutiveDays();
    }
}
