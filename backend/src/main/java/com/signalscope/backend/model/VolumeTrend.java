package com.signalscope.backend.model;

public enum VolumeTrend {
    HIGH,
    NORMAL,
    LOW
}
