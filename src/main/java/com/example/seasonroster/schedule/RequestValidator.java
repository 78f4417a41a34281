package com.example.seasonroster.schedule;

import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.exception.ScheduleGenerationException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Preconditions checked before anything is allocated.
 */
@Component
public class RequestValidator {

    public void validate(GenerateRosterRequest request) {
        if (request.period() == null || request.period().startDate() == null || request.period().weeks() < 1) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_PERIOD,
                    "Period needs a start date and at least one week");
        }
        if (request.shoulderSeason() && request.scheduleBeachShop()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.SHOULDER_WITH_BEACH_SHOP,
                    "Shoulder season mode cannot schedule the beach shop");
        }
        if (request.seasonRules() == null || !request.seasonRules().isComplete()) {
            throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_SEASON_RULES,
                    "All four season anchor dates are required");
        }
        Set<String> ids = new HashSet<>();
        for (Employee e : request.employees()) {
            if (!ids.add(e.id())) {
                throw new ScheduleGenerationException(ScheduleGenerationException.DUPLICATE_EMPLOYEE,
                        "Duplicate employee id " + e.id(), e.id());
            }
            if (e.minHoursPerWeek() < 0 || e.maxHoursPerWeek() < 0 || e.minHoursPerWeek() > e.maxHoursPerWeek()) {
                throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_HOUR_BOUNDS,
                        e.name() + " has minimum " + e.minHoursPerWeek() + "h above maximum " + e.maxHoursPerWeek() + "h",
                        e.id());
            }
        }
        for (GenerateRosterRequest.AdHocBooking booking : request.adHocBookings()) {
            if (booking.employeeId() == null || booking.date() == null || booking.location() == null) {
                throw new ScheduleGenerationException(ScheduleGenerationException.INVALID_AD_HOC_BOOKING,
                        "Ad-hoc booking needs an employee, a date and a location");
            }
        }
    }
}
