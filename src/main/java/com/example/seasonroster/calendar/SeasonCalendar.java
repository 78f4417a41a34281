package com.example.seasonroster.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolved day sequence of one generation period with per-day opening flags.
 */
public final class SeasonCalendar {

    private final LocalDate start;
    private final int weeks;
    private final SeasonRules rules;
    private final List<LocalDate> days;
    private final Map<LocalDate, SeasonRegime> regimes;
    private final Set<LocalDate> greystonesOpen;
    private final Set<LocalDate> beachShopOpen;

    SeasonCalendar(LocalDate start, int weeks, SeasonRules rules, List<LocalDate> days,
                   Map<LocalDate, SeasonRegime> regimes, Set<LocalDate> greystonesOpen, Set<LocalDate> beachShopOpen) {
        this.start = start;
        this.weeks = weeks;
        this.rules = rules;
        this.days = List.copyOf(days);
        this.regimes = Map.copyOf(regimes);
        this.greystonesOpen = Set.copyOf(greystonesOpen);
        this.beachShopOpen = Set.copyOf(beachShopOpen);
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return start.plusDays(7L * weeks - 1);
    }

    public SeasonRules getRules() {
        return rules;
    }

    public List<LocalDate> getDays() {
        return days;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(getEnd());
    }

    public SeasonRegime regimeOf(LocalDate date) {
        return regimes.getOrDefault(date, rules.regimeOf(date));
    }

    public boolean isGreystonesOpen(LocalDate date) {
        return greystonesOpen.contains(date);
    }

    public boolean isBeachShopOpen(LocalDate date) {
        return beachShopOpen.contains(date);
    }

    public List<LocalDate> getWeekStarts() {
        List<LocalDate> starts = new ArrayList<>(weeks);
        for (int i = 0; i < weeks; i++) {
            starts.add(start.plusWeeks(i));
        }
        return Collections.unmodifiableList(starts);
    }

    /** Week start of the period week containing the date; dates before the period use the same 7-day grid. */
    public LocalDate weekStartOf(LocalDate date) {
        long offset = Math.floorMod(date.toEpochDay() - start.toEpochDay(), 7L);
        return date.minusDays(offset);
    }

    public List<LocalDate> daysOfWeek(LocalDate weekStart) {
        List<LocalDate> result = new ArrayList<>(7);
        for (int i = 0; i < 7; i++) {
            result.add(weekStart.plusDays(i));
        }
        return result;
    }

    public List<LocalDate> openDaysOfWeek(LocalDate weekStart) {
        return daysOfWeek(weekStart).stream().filter(this::isGreystonesOpen).toList();
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }
}
