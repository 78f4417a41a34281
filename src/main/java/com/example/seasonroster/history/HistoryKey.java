package com.example.seasonroster.history;

import java.time.LocalDate;

public record HistoryKey(LocalDate weekStart, String employeeId) {
}
