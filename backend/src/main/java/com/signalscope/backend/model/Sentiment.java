package com.signalscope.backend.model;

public enum Sentiment {
    POSITIVE,
    NEGATIVE,
    NEUTRAL
}
