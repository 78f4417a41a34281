package com.example.seasonroster.calendar;

import com.example.seasonroster.exception.ScheduleGenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the period's day sequence and which locations open on each day.
 */
@Component
public class SeasonCalendarResolver {

    private static final Logger logger = LoggerFactory.getLogger(SeasonCalendarResolver.class);

    public SeasonCalendar resolve(LocalDate rawStart, int weeks, DayOfWeek weekStartDay, DayOfWeek weekEndDay,
                                  SeasonRules suppliedRules, Set<DayOfWeek> openWeekdays, boolean scheduleBeachShop) {
        if (weekStartDay.minus(1) != weekEndDay) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_WEEK_BOUNDARY,
                    "Week must run " + weekStartDay + " to " + weekStartDay.minus(1) + ", got " + weekStartDay + "-" + weekEndDay,
                    weekStartDay, weekEndDay);
        }
        LocalDate start = rawStart.with(TemporalAdjusters.nextOrSame(weekStartDay));
        if (!start.equals(rawStart)) {
            logger.debug("Period start {} snapped forward to {}", rawStart, start);
        }

        SeasonRules rules = suppliedRules;
        if (rules == null || !rules.allInYear(start.getYear())) {
            rules = SeasonRules.canonical(start.getYear());
            logger.info("Season anchors recomputed for {}: {}", start.getYear(), rules);
        }

        Set<DayOfWeek> allowed = openWeekdays == null || openWeekdays.isEmpty()
                ? EnumSet.allOf(DayOfWeek.class)
                : EnumSet.copyOf(openWeekdays);

        List<LocalDate> days = new ArrayList<>();
        Map<LocalDate, SeasonRegime> regimes = new HashMap<>();
        Set<LocalDate> greystones = new HashSet<>();
        Set<LocalDate> beach = new HashSet<>();
        for (int i = 0; i < weeks * 7; i++) {
            LocalDate day = start.plusDays(i);
            days.add(day);
            SeasonRegime regime = rules.regimeOf(day);
            regimes.put(day, regime);
            boolean weekend = SeasonCalendar.isWeekend(day);
            boolean mainOpen = allowed.contains(day.getDayOfWeek())
                    && (regime != SeasonRegime.SHOULDER || weekend);
            if (mainOpen) {
                greystones.add(day);
                if (scheduleBeachShop && (weekend || regime == SeasonRegime.PEAK)) {
                    beach.add(day);
                }
            }
        }
        return new SeasonCalendar(start, weeks, rules, days, regimes, greystones, beach);
    }
}
