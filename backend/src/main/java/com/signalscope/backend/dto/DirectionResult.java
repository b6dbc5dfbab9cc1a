package com.signalscope.backend.dto;

import com.signalscope.backend.model.Bias;

public record DirectionResult(Bias bias, int bullishSignals, int bearishSignals, int conviction) {}
