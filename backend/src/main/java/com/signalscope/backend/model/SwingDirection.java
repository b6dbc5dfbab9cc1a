package com.signalscope.backend.model;

public enum SwingDirection {
    UP,
    DOWN
}
