package com.signalscope.backend.model;

public enum Growth {
    STRONG,
    MODERATE,
    WEAK,
    UNKNOWN
}
