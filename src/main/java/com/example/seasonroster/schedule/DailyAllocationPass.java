package com.example.seasonroster.schedule;

import com.example.seasonroster.common.TimeWindow;
import com.example.seasonroster.employee.Employee;
import com.example.seasonroster.employee.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * Fills one open day in role precedence: manager, team leaders, floor, boat captain, beach shop.
 */
@Component
public class DailyAllocationPass {

    private static final Logger logger = LoggerFactory.getLogger(DailyAllocationPass.class);

    private final EligibilityFilter eligibility;

    public DailyAllocationPass(EligibilityFilter eligibility) {
        this.eligibility = eligibility;
    }

    public void allocate(GenerationContext ctx, LocalDate day) {
        if (!ctx.isOpen(Location.GREYSTONES, day)) {
            return;
        }
        TimeWindow window = ctx.windowFor(Location.GREYSTONES);

        boolean managerPresent = assignManager(ctx, day, window);

        int leadersNeeded = ctx.getRequest().leadershipRules().teamLeadersNeeded(managerPresent);
        int leaders = fill(ctx, day, Role.TEAM_LEADER, Location.GREYSTONES, window, leadersNeeded, false);
        // the minimum is met even past the hour ceiling, but only once nobody within it is left
        leaders += fill(ctx, day, Role.TEAM_LEADER, Location.GREYSTONES, window, leadersNeeded - leaders, true);
        if (leaders < leadersNeeded) {
            logger.debug("{}: {} of {} team leaders", day, leaders, leadersNeeded);
        }

        int floorTarget = ctx.getRequest().coverage().floorTarget(day);
        int clerks = fill(ctx, day, Role.STORE_CLERK, Location.GREYSTONES, window, floorTarget - leaders, false);
        int extraLeaders = fill(ctx, day, Role.TEAM_LEADER, Location.GREYSTONES, window,
                floorTarget - leaders - clerks, false);
        if (leaders + clerks + extraLeaders < floorTarget) {
            logger.debug("{}: Greystones floor {} of {}", day, leaders + clerks + extraLeaders, floorTarget);
        }

        // the boat sails whenever anyone can take it
        int captains = fill(ctx, day, Role.BOAT_CAPTAIN, Location.BOAT, window, 1, false);
        if (captains == 0) {
            captains = fill(ctx, day, Role.BOAT_CAPTAIN, Location.BOAT, window, 1, true);
        }
        if (captains == 0) {
            logger.debug("{}: no boat captain", day);
        }

        if (ctx.isOpen(Location.BEACH_SHOP, day)) {
            staffBeachShop(ctx, day);
        }
    }

    private boolean assignManager(GenerationContext ctx, LocalDate day, TimeWindow window) {
        int managers = fill(ctx, day, Role.STORE_MANAGER, Location.GREYSTONES, window, 1, false);
        if (managers == 0 && ctx.isShoulder()) {
            managers = fill(ctx, day, Role.STORE_MANAGER, Location.GREYSTONES, window, 1, true);
        }
        return managers > 0;
    }

    private void staffBeachShop(GenerationContext ctx, LocalDate day) {
        TimeWindow window = ctx.windowFor(Location.BEACH_SHOP);
        int needed = ctx.getRequest().coverage().beachShopStaff();
        int staffed = fill(ctx, day, Role.STORE_CLERK, Location.BEACH_SHOP, window, needed, false);
        staffed += fill(ctx, day, Role.TEAM_LEADER, Location.BEACH_SHOP, window, needed - staffed, false);

        int pulls = 0;
        int pullCap = ctx.getRules().getBeachShopFloorPullCap();
        while (staffed < needed && pulls < pullCap) {
            Employee pulled = floorPullCandidate(ctx, day, window);
            if (pulled == null) {
                break;
            }
            ctx.assign(pulled, day, Location.BEACH_SHOP, window, Provenance.GENERATED);
            logger.debug("{}: {} pulled from the floor to the beach shop", day, pulled.name());
            staffed++;
            pulls++;
        }
        if (staffed < needed) {
            logger.debug("{}: beach shop {} of {}", day, staffed, needed);
        }
    }

    private Employee floorPullCandidate(GenerationContext ctx, LocalDate day, TimeWindow window) {
        for (Role role : List.of(Role.STORE_CLERK, Role.TEAM_LEADER)) {
            for (Employee e : eligibility.eligible(ctx, day, role, window, false, true)) {
                if (ctx.isAssignedAt(e.id(), day, Location.GREYSTONES)
                        && !ctx.isAssignedAt(e.id(), day, Location.BEACH_SHOP)) {
                    return e;
                }
            }
        }
        return null;
    }

    /**
     * Assigns up to {@code count} employees one at a time, re-ranking after each pick.
     *
     * @return number assigned
     */
    private int fill(GenerationContext ctx, LocalDate day, Role role, Location location, TimeWindow window,
                     int count, boolean ignoreMax) {
        int assigned = 0;
        while (assigned < count) {
            List<Employee> candidates = eligibility.eligible(ctx, day, role, window, ignoreMax, false);
            if (candidates.isEmpty()) {
                break;
            }
            ctx.assign(candidates.get(0), day, location, window, Provenance.GENERATED);
            assigned++;
        }
        return assigned;
    }
}
