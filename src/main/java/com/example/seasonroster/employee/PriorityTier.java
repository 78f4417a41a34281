package com.example.seasonroster.employee;

/**
 * Staffing priority; A is the highest. Declaration order is the ordering (A &lt; B &lt; C).
 */
public enum PriorityTier {
    A,
    B,
    C
}
