package com.example.usagemeter.model;

public enum AnalyticsGrouping {
    DAY,
    HOUR,
    ACTION
}
