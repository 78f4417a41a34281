package com.example.seasonroster.schedule;

import java.time.LocalDate;

/**
 * Hours, worked days and weekend days of one employee in one period week.
 * A day spent only at the beach shop counts as half a day.
 */
public record WeekTotals(int weekIndex, LocalDate weekStart, double hours, double days, int weekendDays) {
}
