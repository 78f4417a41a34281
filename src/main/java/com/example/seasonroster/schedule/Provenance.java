package com.example.seasonroster.schedule;

public enum Provenance {
    GENERATED,
    AD_HOC
}
