package com.example.seasonroster.config;

import com.example.seasonroster.history.HistoricalAggregates;
import com.example.seasonroster.history.HistoricalCarryoverSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HistoryConfig {

    private static final Logger logger = LoggerFactory.getLogger(HistoryConfig.class);

    /**
     * Used until a persistence layer provides finalized schedules.
     */
    @Bean
    @ConditionalOnMissingBean(HistoricalCarryoverSource.class)
    public HistoricalCarryoverSource historicalCarryoverSource() {
        logger.info("No historical carryover source configured, fairness starts without history");
        return (periodStart, employeeIds) -> HistoricalAggregates.empty();
    }
}
