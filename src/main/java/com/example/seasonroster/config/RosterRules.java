package com.example.seasonroster.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Tunable allocation limits, bound from {@code roster.*} properties.
 */
@Component
public class RosterRules {
    private final int maxConsecutiveDays;
    private final int managerMaxDaysPerWeek;
    private final int historyLookbackWeeks;
    private final int offStreakLookbackDays;
    private final int beachShopFloorPullCap;

    public RosterRules(
            @Value("${roster.rules.max-consecutive-days:5}") int maxConsecutiveDays,
            @Value("${roster.rules.manager-max-days-per-week:5}") int managerMaxDaysPerWeek,
            @Value("${roster.rules.history-lookback-weeks:4}") int historyLookbackWeeks,
            @Value("${roster.rules.off-streak-lookback-days:7}") int offStreakLookbackDays,
            @Value("${roster.rules.beach-shop-floor-pull-cap:1}") int beachShopFloorPullCap) {
        this.maxConsecutiveDays = maxConsecutiveDays;
        this.managerMaxDaysPerWeek = managerMaxDaysPerWeek;
        this.historyLookbackWeeks = historyLookbackWeeks;
        this.offStreakLookbackDays = offStreakLookbackDays;
        this.beachShopFloorPullCap = beachShopFloorPullCap;
    }

    public static RosterRules defaults() {
        return new RosterRules(5, 5, 4, 7, 1);
    }

    public int getMaxConsecutiveDays() { return maxConsecutiveDays; }
    public int getManagerMaxDaysPerWeek() { return managerMaxDaysPerWeek; }
    public int getHistoryLookbackWeeks() { return historyLookbackWeeks; }
    public int getOffStreakLookbackDays() { return offStreakLookbackDays; }
    public int getBeachShopFloorPullCap() { return beachShopFloorPullCap; }
}
