package com.signalscope.backend.model;

public enum Reliability {
    HIGH,
    MEDIUM,
    LOW
}
