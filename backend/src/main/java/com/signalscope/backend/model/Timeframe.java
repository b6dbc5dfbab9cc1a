package com.signalscope.backend.model;

public enum Timeframe {
    DAILY("1D", "Daily"),
    WEEKLY("1W", "Weekly"),
    MONTHLY("1M", "Monthly");

    private final String code;
    private final String displayName;

    Timeframe(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }
}
