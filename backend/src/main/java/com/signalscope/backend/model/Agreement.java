package com.signalscope.backend.model;

public enum Agreement {
    STRONG,
    MODERATE,
    WEAK,
    CONFLICT
}
