package com.example.seasonroster.schedule;

import com.example.seasonroster.calendar.SeasonCalendar;
import com.example.seasonroster.calendar.SeasonRules;
import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable input snapshot of one generation call.
 */
public record GenerateRosterRequest(
        @Valid @NotNull(message = "period is required") Period period,
        DayOfWeek weekStartDay,
        DayOfWeek weekEndDay,
        @Valid SeasonRules seasonRules,
        @Valid Hours hours,
        @Valid Coverage coverage,
        @Valid LeadershipRules leadershipRules,
        @NotEmpty(message = "employees must not be empty") List<@Valid Employee> employees,
        List<@Valid Unavailability> unavailability,
        List<@Valid AdHocBooking> adHocBookings,
        Set<DayOfWeek> openWeekdays,
        String rerollToken,
        boolean shoulderSeason,
        boolean scheduleBeachShop) {

    public GenerateRosterRequest {
        weekStartDay = weekStartDay == null ? DayOfWeek.MONDAY : weekStartDay;
        weekEndDay = weekEndDay == null ? weekStartDay.minus(1) : weekEndDay;
        hours = hours == null ? Hours.defaults() : hours;
        coverage = coverage == null ? Coverage.defaults() : coverage;
        leadershipRules = leadershipRules == null ? LeadershipRules.defaults() : leadershipRules;
        employees = employees == null ? List.of() : List.copyOf(employees);
        unavailability = unavailability == null ? List.of() : List.copyOf(unavailability);
        adHocBookings = adHocBookings == null ? List.of() : List.copyOf(adHocBookings);
        openWeekdays = openWeekdays == null || openWeekdays.isEmpty()
                ? Set.copyOf(EnumSet.allOf(DayOfWeek.class))
                : Set.copyOf(openWeekdays);
        rerollToken = rerollToken == null || rerollToken.isBlank() ? "0" : rerollToken;
    }

    public record Period(
            @NotNull(message = "startDate is required") LocalDate startDate,
            @Min(value = 1, message = "weeks must be at least 1") int weeks) {
    }

    public record Hours(TimeWindow greystones, TimeWindow beachShop) {

        public static final TimeWindow DEFAULT_GREYSTONES = TimeWindow.of("08:30", "17:30");
        public static final TimeWindow DEFAULT_BEACH_SHOP = TimeWindow.of("12:00", "16:00");

        public Hours {
            greystones = greystones == null ? DEFAULT_GREYSTONES : greystones;
            beachShop = beachShop == null ? DEFAULT_BEACH_SHOP : beachShop;
        }

        public static Hours defaults() {
            return new Hours(DEFAULT_GREYSTONES, DEFAULT_BEACH_SHOP);
        }

        public TimeWindow windowFor(Location location) {
            return location == Location.BEACH_SHOP ? beachShop : greystones;
        }
    }

    public record Coverage(
            @PositiveOrZero int greystonesWeekdayStaff,
            @PositiveOrZero int greystonesWeekendStaff,
            @PositiveOrZero int beachShopStaff) {

        public static Coverage defaults() {
            return new Coverage(3, 4, 2);
        }

        public int floorTarget(LocalDate date) {
            return SeasonCalendar.isWeekend(date) ? greystonesWeekendStaff : greystonesWeekdayStaff;
        }
    }

    public record LeadershipRules(
            @PositiveOrZero int minTeamLeadersEveryOpenDay,
            @PositiveOrZero int teamLeadersIfManagerOff,
            boolean managerTwoConsecutiveDaysOffPerWeek) {

        public static LeadershipRules defaults() {
            return new LeadershipRules(1, 2, true);
        }

        public int teamLeadersNeeded(boolean managerPresent) {
            return managerPresent ? minTeamLeadersEveryOpenDay : Math.max(minTeamLeadersEveryOpenDay, teamLeadersIfManagerOff);
        }
    }

    public record Unavailability(
            @NotBlank String employeeId,
            @NotNull LocalDate date,
            String reason) {
    }

    /**
     * Caller-supplied one-off shift. Times stay raw strings so malformed values degrade to conflicts.
     */
    public record AdHocBooking(
            @NotBlank String employeeId,
            @NotNull LocalDate date,
            String start,
            String end,
            @NotNull Location location,
            String note) {
    }
}
