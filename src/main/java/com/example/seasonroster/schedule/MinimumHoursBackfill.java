package com.example.seasonroster.schedule;

import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static java.time.DayOfWeek.THURSDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;

/**
 * Tops up employees left under their weekly minimum after the daily pass.
 */
@Component
public class MinimumHoursBackfill {

    private static final Logger logger = LoggerFactory.getLogger(MinimumHoursBackfill.class);

    private static final Map<Role, List<DayOfWeek>> MAKEUP_DAYS = new EnumMap<>(Role.class);

    static {
        MAKEUP_DAYS.put(Role.TEAM_LEADER, List.of(FRIDAY, MONDAY, SATURDAY, SUNDAY, THURSDAY, TUESDAY, WEDNESDAY));
        MAKEUP_DAYS.put(Role.STORE_CLERK, List.of(WEDNESDAY, TUESDAY, THURSDAY, FRIDAY, MONDAY, SATURDAY, SUNDAY));
        MAKEUP_DAYS.put(Role.STORE_MANAGER, List.of(TUESDAY, WEDNESDAY, THURSDAY, MONDAY, FRIDAY, SATURDAY, SUNDAY));
    }

    private final EligibilityFilter eligibility;

    public MinimumHoursBackfill(EligibilityFilter eligibility) {
        this.eligibility = eligibility;
    }

    public void backfill(GenerationContext ctx) {
        if (ctx.isShoulder()) {
            return;
        }
        int added = 0;
        for (LocalDate weekStart : ctx.getCalendar().getWeekStarts()) {
            if (ctx.getCalendar().openDaysOfWeek(weekStart).isEmpty()) {
                continue;
            }
            for (Employee e : ctx.getEmployees()) {
                if (ctx.hasTimeOffInWeek(e.id(), weekStart)) {
                    continue;
                }
                added += topUp(ctx, e, weekStart);
            }
        }
        if (added > 0) {
            logger.debug("Backfill added {} shifts", added);
        }
    }

    private int topUp(GenerationContext ctx, Employee e, LocalDate weekStart) {
        Location location = Location.homeOf(e.role());
        TimeWindow window = ctx.windowFor(location);
        int added = 0;
        for (LocalDate day : makeupDays(ctx, e.role(), weekStart)) {
            if (ctx.weekHours(e.id(), weekStart) >= e.minHoursPerWeek()) {
                break;
            }
            if (!ctx.isOpen(location, day)) {
                continue;
            }
            if (e.role() == Role.STORE_MANAGER && ctx.countOn(day, Location.GREYSTONES, Role.STORE_MANAGER) > 0) {
                continue;
            }
            if (eligibility.isEligible(ctx, e, day, window, false, false)) {
                ctx.assign(e, day, location, window, Provenance.GENERATED);
                added++;
            }
        }
        return added;
    }

    /** Boat captains keep calendar order; other roles follow their make-up ranking. */
    private List<LocalDate> makeupDays(GenerationContext ctx, Role role, LocalDate weekStart) {
        List<LocalDate> days = ctx.getCalendar().daysOfWeek(weekStart);
        List<DayOfWeek> ranking = MAKEUP_DAYS.get(role);
        if (ranking == null) {
            return days;
        }
        return days.stream().sorted(Comparator.comparingInt(d -> ranking.indexOf(d.getDayOfWeek()))).toList();
    }
}
