package com.example.seasonroster.schedule;

import com.example.seasonroster.employee.Role;

import java.util.EnumSet;
import java.util.Set;

public enum Location {
    GREYSTONES("Greystones", EnumSet.of(Role.STORE_MANAGER, Role.TEAM_LEADER, Role.STORE_CLERK)),
    BEACH_SHOP("Beach Shop", EnumSet.of(Role.STORE_CLERK, Role.TEAM_LEADER)),
    BOAT("Boat", EnumSet.of(Role.BOAT_CAPTAIN));

    private final String displayName;
    private final Set<Role> roles;

    Location(String displayName, Set<Role> roles) {
        this.displayName = displayName;
        this.roles = roles;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean accepts(Role role) {
        return roles.contains(role);
    }

    /** Where an employee of this role works by default. */
    public static Location homeOf(Role role) {
        return role == Role.BOAT_CAPTAIN ? BOAT : GREYSTONES;
    }
}
