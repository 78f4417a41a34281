package com.example.seasonroster.schedule;

import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.calendar.SeasonCalendarResolver;
import com.example.seasonroster.config.RosterRules;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.history.HistoricalAggregates;
import com.example.seasonroster.history.HistoricalCarryoverSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

/**
 * Generates a roster for one period. Each call works on its own {@link GenerationContext}; the
 * service keeps no state between calls.
 */
@Service
public class RosterGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(RosterGenerationService.class);

    private final RequestValidator validator;
    private final SeasonCalendarResolver calendarResolver;
    private final RosterRules rules;
    private final ManagerRestPlanner restPlanner;
    private final DailyAllocationPass dailyPass;
    private final MinimumHoursBackfill backfill;
    private final AdHocBookingReconciler adHocReconciler;
    private final RosterAggregator aggregator;
    private final HistoricalCarryoverSource historySource;

    public RosterGenerationService(RequestValidator validator,
                                   SeasonCalendarResolver calendarResolver,
                                   RosterRules rules,
                                   ManagerRestPlanner restPlanner,
                                   DailyAllocationPass dailyPass,
                                   MinimumHoursBackfill backfill,
                                   AdHocBookingReconciler adHocReconciler,
                                   RosterAggregator aggregator,
                                   HistoricalCarryoverSource historySource) {
        this.validator = validator;
        this.calendarResolver = calendarResolver;
        this.rules = rules;
        this.restPlanner = restPlanner;
        this.dailyPass = dailyPass;
        this.backfill = backfill;
        this.adHocReconciler = adHocReconciler;
        this.aggregator = aggregator;
        this.historySource = historySource;
    }

    /** Uses history from the configured {@link HistoricalCarryoverSource}. */
    public RosterResult generate(GenerateRosterRequest request) {
        validator.validate(request);
        LocalDate start = request.period().startDate();
        HistoricalAggregates history = historySource.load(start,
                request.employees().stream().map(Employee::id).toList());
        return run(request, history);
    }

    public RosterResult generate(GenerateRosterRequest request, HistoricalAggregates history) {
        validator.validate(request);
        return run(request, history);
    }

    private RosterResult run(GenerateRosterRequest request, HistoricalAggregates history) {
        SeasonCalendar calendar = calendarResolver.resolve(
                request.period().startDate(),
                request.period().weeks(),
                request.weekStartDay(),
                request.weekEndDay(),
                request.seasonRules(),
                request.openWeekdays(),
                request.scheduleBeachShop());
        GenerationContext ctx = new GenerationContext(request, calendar, rules, history);
        logger.info("Generating roster {} to {} for {} employees (shoulder={}, beachShop={}, reroll={})",
                calendar.getStart(), calendar.getEnd(), request.employees().size(),
                request.shoulderSeason(), request.scheduleBeachShop(), request.rerollToken());

        restPlanner.plan(ctx);
        for (LocalDate day : calendar.getDays()) {
            dailyPass.allocate(ctx, day);
            adHocReconciler.reconcileDay(ctx, day);
        }
        backfill.backfill(ctx);
        adHocReconciler.reportOutsidePeriod(ctx);

        RosterResult result = aggregator.aggregate(ctx);
        logger.info("Roster {} to {}: {} assignments, {} violations",
                result.periodStart(), result.periodEnd(), result.assignments().size(), result.violations().size());
        return result;
    }
}
