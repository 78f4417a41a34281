package com.example.seasonroster.schedule;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum ViolationType {
    COVERAGE_GAP("coverage_gap"),
    LEADER_GAP("leader_gap"),
    ROLE_MISSING("role_missing"),
    BEACH_SHOP_GAP("beach_shop_gap"),
    MANAGER_CONSECUTIVE_DAYS_OFF("manager_consecutive_days_off"),
    MANAGER_EXPECTED_DAYS("manager_expected_days"),
    HOURS_MIN_VIOLATION("hours_min_violation"),
    HOURS_MAX_VIOLATION("hours_max_violation"),
    AD_HOC_CONFLICT("ad_hoc_conflict");

    private final String code;

    ViolationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ViolationType fromCode(String code) {
        return Arrays.stream(values())
                .filter(v -> v.code.equals(code) || v.name().equals(code))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown violation type: " + code));
    }
}
