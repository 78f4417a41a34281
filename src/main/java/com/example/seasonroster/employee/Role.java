package com.example.seasonroster.employee;

/**
 * Closed set of roster roles, declared in allocation precedence order.
 */
public enum Role {
    STORE_MANAGER("Store Manager"),
    TEAM_LEADER("Team Leader"),
    STORE_CLERK("Store Clerk"),
    BOAT_CAPTAIN("Boat Captain");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Counts toward the main location's per-day headcount target. */
    public boolean isFloorRole() {
        return this == TEAM_LEADER || this == STORE_CLERK;
    }
}
