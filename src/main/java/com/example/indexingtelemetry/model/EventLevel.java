package com.example.indexingtelemetry.model;

public enum EventLevel {
    INFO,
    DEBUG,
    ERROR,
    WARNING,
    STATS
}
