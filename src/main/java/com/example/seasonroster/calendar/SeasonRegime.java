package com.example.seasonroster.calendar;

public enum SeasonRegime {
    OFF_SEASON,
    SHOULDER,
    PEAK
}
