package com.example.seasonroster.schedule;

import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Reserves two back-to-back days off per week for each store manager before allocation starts.
 */
@Component
public class ManagerRestPlanner {

    private static final Logger logger = LoggerFactory.getLogger(ManagerRestPlanner.class);

    public void plan(GenerationContext ctx) {
        if (ctx.isShoulder() || !ctx.getRequest().leadershipRules().managerTwoConsecutiveDaysOffPerWeek()) {
            return;
        }
        SeasonCalendar calendar = ctx.getCalendar();
        for (Employee manager : ctx.getEmployees()) {
            if (manager.role() != Role.STORE_MANAGER) {
                continue;
            }
            for (LocalDate weekStart : calendar.getWeekStarts()) {
                List<LocalDate> days = calendar.daysOfWeek(weekStart);
                boolean[] off = new boolean[7];
                for (int i = 0; i < 7; i++) {
                    LocalDate d = days.get(i);
                    off[i] = !calendar.isGreystonesOpen(d) || ctx.isBlackedOut(manager.id(), d);
                }
                boolean hasPair = IntStream.range(0, 6).anyMatch(i -> off[i] && off[i + 1]);
                if (hasPair) {
                    continue;
                }
                int best = IntStream.range(0, 6).boxed()
                        .min(Comparator.<Integer>comparingInt(i -> touchesWeekend(days, i) ? 1 : 0)
                                .thenComparingInt(i -> -((off[i] ? 1 : 0) + (off[i + 1] ? 1 : 0)))
                                .thenComparingInt(i -> i))
                        .orElseThrow();
                ctx.forceOff(manager.id(), days.get(best));
                ctx.forceOff(manager.id(), days.get(best + 1));
                logger.debug("{} forced off {} and {}", manager.name(), days.get(best), days.get(best + 1));
            }
        }
    }

    private boolean touchesWeekend(List<LocalDate> days, int i) {
        return SeasonCalendar.isWeekend(days.get(i)) || SeasonCalendar.isWeekend(days.get(i + 1));
    }
}
