package com.example.seasonroster.schedule;

import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.PriorityTier;
import com.example.seasonroster.employee.Role;
import com.example.seasonroster.exception.ScheduleGenerationException;
import com.example.seasonroster.history.HistoricalAggregates;
import com.example.seasonroster.history.HistoryKey;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static com.example.seasonroster.schedule.RosterFixtures.employee;
import static com.example.seasonroster.schedule.RosterFixtures.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class RosterGenerationServiceTest {

    private static final LocalDate MON = LocalDate.of(2026, 1, 5);
    private static final LocalDate PRIOR_WEEK = LocalDate.of(2025, 12, 29);

    @Autowired
    private RosterGenerationService generationService;

    @Test
    void generate_singleOpenMonday_leaderFillsFloorTarget() {
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(Set.of(DayOfWeek.MONDAY))
                .coverage(1, 1, 0)
                .employees(
                        employee("m1", "Morgan", Role.STORE_MANAGER),
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("c1", "Casey", Role.STORE_CLERK),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(result.assignments())
                .extracting(Assignment::employeeId)
                .containsExactlyInAnyOrder("m1", "t1", "b1");
        assertThat(result.assignments()).allMatch(a -> a.date().equals(MON));
        assertThat(result.assignments()).filteredOn(a -> a.employeeId().equals("b1"))
                .extracting(Assignment::location).containsExactly(Location.BOAT);
        assertThat(result.violationsOf(ViolationType.COVERAGE_GAP)).isEmpty();
        assertThat(result.violations()).isEmpty();
    }

    @Test
    void generate_floorRole_prefersLowerHistoricalHours() {
        HistoricalAggregates history = new HistoricalAggregates(
                Map.of(new HistoryKey(PRIOR_WEEK, "c1"), 30.0, new HistoryKey(PRIOR_WEEK, "c2"), 10.0),
                Map.of(), Map.of());
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(Set.of(DayOfWeek.MONDAY))
                .coverage(2, 2, 0)
                .leadership(1, 1, true)
                .employees(
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("c1", "Casey", Role.STORE_CLERK),
                        employee("c2", "Drew", Role.STORE_CLERK),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN))
                .build();

        RosterResult result = generationService.generate(req, history);

        assertThat(ids(result, MON, Location.GREYSTONES, Role.STORE_CLERK)).containsExactly("c2");
    }

    @Test
    void generate_historyWorkedDays_blockSixthConsecutiveDay() {
        Set<LocalDate> worked = Set.of(
                LocalDate.of(2025, 12, 31), LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 2),
                LocalDate.of(2026, 1, 3), LocalDate.of(2026, 1, 4));
        HistoricalAggregates history = new HistoricalAggregates(
                Map.of(new HistoryKey(PRIOR_WEEK, "c1"), 40.0, new HistoryKey(PRIOR_WEEK, "c2"), 40.0),
                Map.of(),
                Map.of(new HistoryKey(PRIOR_WEEK, "c1"), worked));
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(Set.of(DayOfWeek.MONDAY))
                .coverage(2, 2, 0)
                .leadership(1, 1, true)
                .employees(
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("c1", "Casey", Role.STORE_CLERK),
                        employee("c2", "Drew", Role.STORE_CLERK))
                .build();

        RosterResult result = generationService.generate(req, history);

        assertThat(ids(result, MON, Location.GREYSTONES, Role.STORE_CLERK)).containsExactly("c2");
    }

    @Test
    void generate_managerOff_assignsTwoLeadersBeyondMaxHours() {
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(Set.of(DayOfWeek.MONDAY))
                .coverage(2, 2, 0)
                .leadership(1, 2, true)
                .unavailable("m1", MON)
                .employees(
                        employee("m1", "Morgan", Role.STORE_MANAGER),
                        employee("t1", "Lee", Role.TEAM_LEADER, 0, 0),
                        employee("t2", "Tess", Role.TEAM_LEADER, 0, 0),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(ids(result, MON, Location.GREYSTONES, Role.STORE_MANAGER)).isEmpty();
        assertThat(ids(result, MON, Location.GREYSTONES, Role.TEAM_LEADER)).containsExactlyInAnyOrder("t1", "t2");
        assertThat(result.violationsOf(ViolationType.HOURS_MAX_VIOLATION))
                .extracting(Violation::detail)
                .containsExactlyInAnyOrder("Lee scheduled 8h, maximum is 0h", "Tess scheduled 8h, maximum is 0h");
        assertThat(result.violationsOf(ViolationType.LEADER_GAP)).isEmpty();
        assertThat(result.violationsOf(ViolationType.MANAGER_EXPECTED_DAYS)).isEmpty();
    }

    @Test
    void generate_boatCaptainOverMaxHours_stillSailsEveryOpenDay() {
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(RosterFixtures.WEEKDAYS)
                .leadership(1, 1, true)
                .employees(
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN, 0, 0))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(result.assignments()).filteredOn(a -> a.location() == Location.BOAT).hasSize(5);
        assertThat(result.violationsOf(ViolationType.ROLE_MISSING)).isEmpty();
        assertThat(result.totalsFor("b1").week(0).hours()).isEqualTo(40.0);
    }

    @Test
    void generate_withoutBoatCaptain_reportsRoleMissingPerOpenDay() {
        GenerateRosterRequest req = request(MON, 1)
                .openWeekdays(RosterFixtures.WEEKDAYS)
                .leadership(1, 1, true)
                .employees(employee("t1", "Lee", Role.TEAM_LEADER))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(result.violationsOf(ViolationType.ROLE_MISSING))
                .hasSize(5)
                .allMatch(v -> v.detail().equals("No Boat Captain on the roster"));
    }

    @Test
    void generate_fullyOpenWeek_managerRestsOnWeekdayPair() {
        GenerateRosterRequest req = request(MON, 1)
                .coverage(2, 2, 0)
                .employees(fullRoster())
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        Set<LocalDate> managerDays = result.assignments().stream()
                .filter(a -> a.employeeId().equals("m1"))
                .map(Assignment::date)
                .collect(Collectors.toSet());
        assertThat(managerDays).containsExactlyInAnyOrder(
                LocalDate.of(2026, 1, 7), LocalDate.of(2026, 1, 8), LocalDate.of(2026, 1, 9),
                LocalDate.of(2026, 1, 10), LocalDate.of(2026, 1, 11));
        assertThat(result.violationsOf(ViolationType.MANAGER_CONSECUTIVE_DAYS_OFF)).isEmpty();
        assertThat(result.violationsOf(ViolationType.MANAGER_EXPECTED_DAYS)).isEmpty();
    }

    @Test
    void generate_weekdayAndWeekendTargets_fillGreystonesFloorExactly() {
        GenerateRosterRequest req = request(MON, 1)
                .coverage(3, 4, 0)
                .leadership(1, 2, true)
                .employees(fullRoster())
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        for (LocalDate day = MON; day.isBefore(MON.plusDays(7)); day = day.plusDays(1)) {
            boolean weekend = day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY;
            int floor = ids(result, day, Location.GREYSTONES, Role.TEAM_LEADER).size()
                    + ids(result, day, Location.GREYSTONES, Role.STORE_CLERK).size();
            assertThat(floor).as("floor on %s", day).isEqualTo(weekend ? 4 : 3);
        }
        // manager rests Monday and Tuesday, so both leaders cover those days
        assertThat(ids(result, MON, Location.GREYSTONES, Role.TEAM_LEADER)).hasSize(2);
        assertThat(result.violationsOf(ViolationType.COVERAGE_GAP)).isEmpty();
        assertThat(result.violationsOf(ViolationType.LEADER_GAP)).isEmpty();
    }

    @Test
    void generate_shoulderMode_keepsStudentsOffWeekdays() {
        GenerateRosterRequest req = request(MON, 1)
                .shoulder(true)
                .coverage(2, 2, 0)
                .employees(
                        employee("m1", "Morgan", Role.STORE_MANAGER, 0, 48),
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("s1", "Sam", Role.STORE_CLERK, 0, 40, PriorityTier.B, true),
                        employee("c1", "Riley", Role.STORE_CLERK),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        List<Assignment> sam = result.assignments().stream().filter(a -> a.employeeId().equals("s1")).toList();
        assertThat(sam).isNotEmpty();
        assertThat(sam).allMatch(a -> a.date().getDayOfWeek() == DayOfWeek.SATURDAY
                || a.date().getDayOfWeek() == DayOfWeek.SUNDAY);
    }

    @Test
    void generate_shoulderSeason_prefersTopTierClerksOnWeekends() {
        LocalDate september = LocalDate.of(2026, 9, 14);
        GenerateRosterRequest req = request(september, 1)
                .shoulder(true)
                .coverage(2, 2, 0)
                .employees(
                        employee("m1", "Morgan", Role.STORE_MANAGER),
                        employee("t1", "Lee", Role.TEAM_LEADER),
                        employee("c1", "Ana", Role.STORE_CLERK, 0, 40, PriorityTier.A, false),
                        employee("c2", "Ben", Role.STORE_CLERK, 0, 40, PriorityTier.C, false),
                        employee("b1", "Quinn", Role.BOAT_CAPTAIN))
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(result.assignments()).allMatch(a -> a.date().getDayOfWeek() == DayOfWeek.SATURDAY
                || a.date().getDayOfWeek() == DayOfWeek.SUNDAY);
        assertThat(ids(result, LocalDate.of(2026, 9, 19), Location.GREYSTONES, Role.STORE_CLERK)).containsExactly("c1");
        assertThat(ids(result, LocalDate.of(2026, 9, 20), Location.GREYSTONES, Role.STORE_CLERK)).containsExactly("c1");
        assertThat(result.violationsOf(ViolationType.HOURS_MIN_VIOLATION)).isEmpty();
    }

    @Test
    void generate_sameRerollToken_isDeterministic() {
        GenerateRosterRequest req = request(MON, 2)
                .coverage(3, 4, 0)
                .reroll("spring")
                .employees(fullRoster())
                .build();

        RosterResult first = generationService.generate(req, HistoricalAggregates.empty());
        RosterResult second = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(second).isEqualTo(first);
    }

    @Test
    void generate_differentRerollTokens_redistributeTies() {
        Set<String> captains = new HashSet<>();
        for (int token = 0; token < 20; token++) {
            GenerateRosterRequest req = request(MON, 1)
                    .openWeekdays(Set.of(DayOfWeek.MONDAY))
                    .leadership(1, 1, true)
                    .reroll(Integer.toString(token))
                    .employees(
                            employee("t1", "Lee", Role.TEAM_LEADER),
                            employee("b1", "Quinn", Role.BOAT_CAPTAIN),
                            employee("b2", "Rowan", Role.BOAT_CAPTAIN))
                    .build();
            RosterResult result = generationService.generate(req, HistoricalAggregates.empty());
            captains.addAll(ids(result, MON, Location.BOAT, Role.BOAT_CAPTAIN));
        }
        assertThat(captains).containsExactlyInAnyOrder("b1", "b2");
    }

    @Test
    void generate_assignmentsAndViolations_comeBackSorted() {
        GenerateRosterRequest req = request(MON, 1)
                .coverage(3, 4, 0)
                .employees(fullRoster())
                .build();

        RosterResult result = generationService.generate(req, HistoricalAggregates.empty());

        assertThat(result.assignments()).isSortedAccordingTo(Assignment.ROSTER_ORDER);
        assertThat(result.violations()).isSortedAccordingTo(Violation.REPORT_ORDER);
        assertThat(result.totals()).extracting(EmployeeTotals::employeeId)
                .containsExactly("m1", "t1", "t2", "c1", "c2", "c3", "c4", "c5", "b1", "b2");
    }

    @Test
    void generate_shoulderWithBeachShop_isRejected() {
        GenerateRosterRequest req = request(MON, 1)
                .shoulder(true)
                .beachShop(true)
                .employees(employee("t1", "Lee", Role.TEAM_LEADER))
                .build();

        assertThatThrownBy(() -> generationService.generate(req, HistoricalAggregates.empty()))
                .isInstanceOf(ScheduleGenerationException.class)
                .satisfies(e -> assertThat(((ScheduleGenerationException) e).getErrorCode())
                        .isEqualTo(ScheduleGenerationException.SHOULDER_WITH_BEACH_SHOP));
    }

    @Test
    void generate_weekNotSpanningSevenDays_isRejected() {
        GenerateRosterRequest req = request(MON, 1)
                .weekBoundary(DayOfWeek.MONDAY, DayOfWeek.SATURDAY)
                .employees(employee("t1", "Lee", Role.TEAM_LEADER))
                .build();

        assertThatThrownBy(() -> generationService.generate(req, HistoricalAggregates.empty()))
                .isInstanceOf(ScheduleGenerationException.class)
                .satisfies(e -> assertThat(((ScheduleGenerationException) e).getErrorCode())
                        .isEqualTo(ScheduleGenerationException.INVALID_WEEK_BOUNDARY));
    }

    @Test
    void generate_duplicateEmployeeIds_isRejected() {
        GenerateRosterRequest req = request(MON, 1)
                .employees(employee("t1", "Lee", Role.TEAM_LEADER), employee("t1", "Tess", Role.TEAM_LEADER))
                .build();

        assertThatThrownBy(() -> generationService.generate(req, HistoricalAggregates.empty()))
                .isInstanceOf(ScheduleGenerationException.class)
                .hasMessageContaining("Duplicate employee id t1");
    }

    @Test
    void generate_minimumAboveMaximum_isRejected() {
        GenerateRosterRequest req = request(MON, 1)
                .employees(employee("c1", "Casey", Role.STORE_CLERK, 30, 20))
                .build();

        assertThatThrownBy(() -> generationService.generate(req, HistoricalAggregates.empty()))
                .isInstanceOf(ScheduleGenerationException.class)
                .satisfies(e -> assertThat(((ScheduleGenerationException) e).getErrorCode())
                        .isEqualTo(ScheduleGenerationException.INVALID_HOUR_BOUNDS));
    }

    @Test
    void generate_withoutSeasonRules_isRejected() {
        GenerateRosterRequest req = request(MON, 1)
                .seasonRules(null)
                .employees(employee("t1", "Lee", Role.TEAM_LEADER))
                .build();

        assertThatThrownBy(() -> generationService.generate(req))
                .isInstanceOf(ScheduleGenerationException.class)
                .satisfies(e -> assertThat(((ScheduleGenerationException) e).getErrorCode())
                        .isEqualTo(ScheduleGenerationException.INVALID_SEASON_RULES));
    }

    static Employee[] fullRoster() {
        return new Employee[] {
                employee("m1", "Morgan", Role.STORE_MANAGER),
                employee("t1", "Lee", Role.TEAM_LEADER),
                employee("t2", "Tess", Role.TEAM_LEADER),
                employee("c1", "Casey", Role.STORE_CLERK),
                employee("c2", "Drew", Role.STORE_CLERK),
                employee("c3", "Ellis", Role.STORE_CLERK),
                employee("c4", "Finley", Role.STORE_CLERK),
                employee("c5", "Gray", Role.STORE_CLERK),
                employee("b1", "Quinn", Role.BOAT_CAPTAIN),
                employee("b2", "Rowan", Role.BOAT_CAPTAIN)
        };
    }

    static List<String> ids(RosterResult result, LocalDate day, Location location, Role role) {
        return result.assignmentsOn(day).stream()
                .filter(a -> a.location() == location && a.role() == role)
                .map(Assignment::employeeId)
                .toList();
    }
}
