package com.example.seasonroster.history;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Supplies history of schedules finalized before {@code periodStart}. Implemented by the persistence layer.
 */
public interface HistoricalCarryoverSource {

    HistoricalAggregates load(LocalDate periodStart, Collection<String> employeeIds);
}
