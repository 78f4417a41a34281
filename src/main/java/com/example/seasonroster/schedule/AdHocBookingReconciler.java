package com.example.seasonroster.schedule;

import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Layers caller bookings on the generated baseline. A booking that fails a check becomes an
 * {@code ad_hoc_conflict} naming the first failed check.
 */
@Component
public class AdHocBookingReconciler {

    private static final Logger logger = LoggerFactory.getLogger(AdHocBookingReconciler.class);

    private final EligibilityFilter eligibility;

    public AdHocBookingReconciler(EligibilityFilter eligibility) {
        this.eligibility = eligibility;
    }

    /** Applies the bookings dated {@code day}, after that day's baseline. */
    public void reconcileDay(GenerationContext ctx, LocalDate day) {
        for (GenerateRosterRequest.AdHocBooking booking : ctx.getRequest().adHocBookings()) {
            if (day.equals(booking.date())) {
                apply(ctx, booking);
            }
        }
    }

    /** Bookings dated outside the period never reach {@link #reconcileDay}. */
    public void reportOutsidePeriod(GenerationContext ctx) {
        for (GenerateRosterRequest.AdHocBooking booking : ctx.getRequest().adHocBookings()) {
            if (!ctx.getCalendar().contains(booking.date())) {
                apply(ctx, booking);
            }
        }
    }

    void apply(GenerationContext ctx, GenerateRosterRequest.AdHocBooking booking) {
        Employee employee = ctx.employee(booking.employeeId());
        if (employee == null) {
            conflict(ctx, booking, "Ad-hoc booking for unknown employee " + booking.employeeId());
            return;
        }
        Optional<String> problem = check(ctx, employee, booking);
        if (problem.isPresent()) {
            conflict(ctx, booking, employee.name() + ": " + problem.get());
            return;
        }
        TimeWindow window = TimeWindow.of(booking.start(), booking.end());
        ctx.assign(employee, booking.date(), booking.location(), window, Provenance.AD_HOC);
        logger.debug("Ad-hoc booking applied: {} at {} on {} {}", employee.name(),
                booking.location().getDisplayName(), booking.date(), window);
    }

    private Optional<String> check(GenerationContext ctx, Employee employee, GenerateRosterRequest.AdHocBooking booking) {
        LocalDate date = booking.date();
        Location location = booking.location();
        if (!ctx.getCalendar().contains(date)) {
            return Optional.of("date is outside the scheduling period");
        }
        if (!ctx.isOpen(Location.GREYSTONES, date)) {
            return Optional.of("Greystones is closed on that date");
        }
        if (!location.accepts(employee.role())) {
            return Optional.of(employee.role().getDisplayName() + " cannot work at " + location.getDisplayName());
        }
        if (!ctx.isOpen(location, date)) {
            return Optional.of(location.getDisplayName() + " is closed on that date");
        }
        if (ctx.isBlackedOut(employee.id(), date)) {
            return Optional.of("employee is unavailable on that date");
        }
        if (ctx.isAssigned(employee.id(), date)) {
            return Optional.of("employee is already assigned on that date");
        }
        TimeWindow window;
        try {
            window = TimeWindow.of(booking.start(), booking.end());
        } catch (IllegalArgumentException e) {
            return Optional.of("invalid time range " + booking.start() + "-" + booking.end());
        }
        if (!employee.isAvailable(date, window)) {
            return Optional.of("outside availability " + window);
        }
        if (eligibility.exceedsConsecutiveCap(ctx, employee, date)) {
            return Optional.of("would exceed " + ctx.getRules().getMaxConsecutiveDays() + " consecutive work days");
        }
        LocalDate weekStart = ctx.getCalendar().weekStartOf(date);
        double projected = ctx.weekHours(employee.id(), weekStart) + ctx.incrementalHours(employee.id(), date, window);
        if (ctx.exceedsMax(employee, projected)) {
            return Optional.of("would exceed weekly max hours");
        }
        return Optional.empty();
    }

    private void conflict(GenerationContext ctx, GenerateRosterRequest.AdHocBooking booking, String detail) {
        logger.info("Ad-hoc booking skipped on {}: {}", booking.date(), detail);
        ctx.addAdHocConflict(new Violation(booking.date(), ViolationType.AD_HOC_CONFLICT, detail));
    }
}
