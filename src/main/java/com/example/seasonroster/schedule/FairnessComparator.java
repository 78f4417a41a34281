package com.example.seasonroster.schedule;

import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import com.example.seasonroster.history.HistoricalAggregates;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders eligible candidates. Store clerks are ordered workload first; every other role
 * puts off-streak and block continuity first so leadership rotation stays fair.
 */
@Component
public class FairnessComparator {

    private static final Comparator<Scores> FLOOR_ORDER = Comparator
            .comparing(Scores::overtime)
            .thenComparingDouble(Scores::overtimeAmount)
            .thenComparingInt(Scores::overtimeTier)
            .thenComparingDouble(Scores::historical)
            .thenComparingInt(Scores::offStreak)
            .thenComparingInt(Scores::continuity)
            .thenComparingDouble(Scores::weekHours)
            .thenComparingLong(Scores::reroll)
            .thenComparing(Scores::name);

    private static final Comparator<Scores> LEADERSHIP_ORDER = Comparator
            .comparingInt(Scores::offStreak)
            .thenComparingInt(Scores::continuity)
            .thenComparing(Scores::overtime)
            .thenComparingDouble(Scores::overtimeAmount)
            .thenComparingInt(Scores::overtimeTier)
            .thenComparingInt(Scores::rotation)
            .thenComparingDouble(Scores::weekHours)
            .thenComparingLong(Scores::reroll)
            .thenComparing(Scores::name);

    public List<Employee> order(GenerationContext ctx, LocalDate day, Role role, TimeWindow window,
                                List<Employee> candidates) {
        LocalDate weekStart = ctx.getCalendar().weekStartOf(day);
        RotationPair pair = role == Role.TEAM_LEADER ? rotationPair(ctx, weekStart) : null;
        List<Scores> scored = new ArrayList<>(candidates.size());
        for (Employee e : candidates) {
            scored.add(score(ctx, e, day, weekStart, window, pair));
        }
        scored.sort(role == Role.STORE_CLERK ? FLOOR_ORDER : LEADERSHIP_ORDER);
        return scored.stream().map(Scores::employee).toList();
    }

    private Scores score(GenerationContext ctx, Employee e, LocalDate day, LocalDate weekStart,
                         TimeWindow window, RotationPair pair) {
        double weekHours = ctx.weekHours(e.id(), weekStart);
        double projected = weekHours + ctx.incrementalHours(e.id(), day, window);
        boolean overtime = ctx.exceedsMax(e, projected);
        double overtimeAmount = overtime ? projected - e.maxHoursPerWeek() : 0.0;
        // lower tiers absorb forced overtime first
        int overtimeTier = overtime ? -e.priorityTier().ordinal() : 0;
        return new Scores(e,
                overtime,
                overtimeAmount,
                overtimeTier,
                pair == null ? 0 : pair.score(ctx, e, weekStart),
                historical(ctx, e),
                offStreak(ctx, e, day),
                continuity(ctx, e, day),
                weekHours,
                RerollSeed.of(ctx.getRequest().rerollToken(), e.id()),
                e.name());
    }

    /** Trailing history plus hours already given this run; in shoulder mode the tier stands in. */
    double historical(GenerationContext ctx, Employee e) {
        if (ctx.isShoulder()) {
            return e.priorityTier().ordinal();
        }
        HistoricalAggregates history = ctx.getHistory();
        double total = ctx.runHours(e.id());
        for (int i = 1; i <= ctx.getRules().getHistoryLookbackWeeks(); i++) {
            total += history.hours(ctx.getCalendar().getStart().minusWeeks(i), e.id());
        }
        return total;
    }

    /**
     * Negative length of the run of unworked days right before {@code day}; runs shorter than two
     * give no preference. Days before the period count only where history covers them.
     */
    int offStreak(GenerationContext ctx, Employee e, LocalDate day) {
        LocalDate periodStart = ctx.getCalendar().getStart();
        int streak = 0;
        for (int i = 1; i <= ctx.getRules().getOffStreakLookbackDays(); i++) {
            LocalDate d = day.minusDays(i);
            if (d.isBefore(periodStart) && !ctx.hasHistoryRecord(e.id(), d)) {
                break;
            }
            if (ctx.worked(e.id(), d)) {
                break;
            }
            streak++;
        }
        return streak >= 2 ? -streak : 0;
    }

    /**
     * 0 continues yesterday's block, 2 would leave a single day off between two worked days,
     * 1 starts a new block.
     */
    int continuity(GenerationContext ctx, Employee e, LocalDate day) {
        if (ctx.worked(e.id(), day.minusDays(1))) {
            return 0;
        }
        if (ctx.worked(e.id(), day.minusDays(2))) {
            return 2;
        }
        return 1;
    }

    private RotationPair rotationPair(GenerationContext ctx, LocalDate weekStart) {
        List<Employee> leaders = ctx.getEmployees().stream().filter(e -> e.role() == Role.TEAM_LEADER).toList();
        if (leaders.size() != 2) {
            return null;
        }
        Employee first = leaders.get(0);
        Employee second = leaders.get(1);
        LocalDate priorWeek = weekStart.minusWeeks(1);
        int firstPrior = priorLeaderDays(ctx, first, priorWeek);
        int secondPrior = priorLeaderDays(ctx, second, priorWeek);
        String preferred = null;
        if (firstPrior < secondPrior) {
            preferred = first.id();
        } else if (secondPrior < firstPrior) {
            preferred = second.id();
        }
        return new RotationPair(first.id(), second.id(), preferred);
    }

    private int priorLeaderDays(GenerationContext ctx, Employee e, LocalDate priorWeek) {
        if (priorWeek.isBefore(ctx.getCalendar().getStart())) {
            return ctx.getHistory().leaderDays(priorWeek, e.id());
        }
        return ctx.leaderDaysInWeek(e.id(), priorWeek);
    }

    private record RotationPair(String firstId, String secondId, String preferredId) {

        /**
         * Distance from the target gap after giving {@code candidate} this day: one day ahead for the
         * preferred member, level when there is none.
         */
        int score(GenerationContext ctx, Employee candidate, LocalDate weekStart) {
            String otherId = candidate.id().equals(firstId) ? secondId : firstId;
            int mine = ctx.leaderDaysInWeek(candidate.id(), weekStart) + 1;
            int other = ctx.leaderDaysInWeek(otherId, weekStart);
            if (preferredId == null) {
                return Math.abs(mine - other);
            }
            int preferredCount = candidate.id().equals(preferredId) ? mine : other;
            int otherCount = candidate.id().equals(preferredId) ? other : mine;
            return Math.abs(preferredCount - otherCount - 1);
        }
    }

    private record Scores(
            Employee employee,
            boolean overtime,
            double overtimeAmount,
            int overtimeTier,
            int rotation,
            double historical,
            int offStreak,
            int continuity,
            double weekHours,
            long reroll,
            String name) {
    }
}
