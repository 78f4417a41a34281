package com.example.seasonroster.schedule;

import java.time.LocalDate;
import java.util.Comparator;

public record Violation(LocalDate date, ViolationType type, String detail) {

    public static final Comparator<Violation> REPORT_ORDER = Comparator
            .comparing(Violation::date)
            .thenComparing(v -> v.type().getCode())
            .thenComparing(Violation::detail);
}
