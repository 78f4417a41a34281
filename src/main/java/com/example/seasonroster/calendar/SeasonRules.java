package com.example.seasonroster.calendar;

import jakarta.validation.constraints.NotNull;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.stream.Stream;

/**
 * Anchor dates that split one year into season regimes.
 */
public record SeasonRules(
        @NotNull LocalDate victoriaDay,
        @NotNull LocalDate june30,
        @NotNull LocalDate labourDay,
        @NotNull LocalDate oct31) {

    /**
     * Anchors for the given year: Victoria Day is the Monday before May 25,
     * Labour Day the first Monday of September.
     */
    public static SeasonRules canonical(int year) {
        LocalDate victoria = LocalDate.of(year, 5, 25).with(TemporalAdjusters.previous(DayOfWeek.MONDAY));
        LocalDate labour = LocalDate.of(year, 9, 1).with(TemporalAdjusters.firstInMonth(DayOfWeek.MONDAY));
        return new SeasonRules(victoria, LocalDate.of(year, 6, 30), labour, LocalDate.of(year, 10, 31));
    }

    public boolean isComplete() {
        return victoriaDay != null && june30 != null && labourDay != null && oct31 != null;
    }

    public boolean allInYear(int year) {
        return isComplete() && Stream.of(victoriaDay, june30, labourDay, oct31).allMatch(d -> d.getYear() == year);
    }

    public SeasonRegime regimeOf(LocalDate date) {
        if (date.isAfter(june30) && !date.isAfter(labourDay)) {
            return SeasonRegime.PEAK;
        }
        if (!date.isBefore(victoriaDay) && !date.isAfter(june30)) {
            return SeasonRegime.SHOULDER;
        }
        if (date.isAfter(labourDay) && !date.isAfter(oct31)) {
            return SeasonRegime.SHOULDER;
        }
        return SeasonRegime.OFF_SEASON;
    }
}
