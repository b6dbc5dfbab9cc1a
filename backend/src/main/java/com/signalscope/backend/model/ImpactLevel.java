package com.signalscope.backend.model;

public enum ImpactLevel {
    HIGH,
    MEDIUM,
    LOW
}
