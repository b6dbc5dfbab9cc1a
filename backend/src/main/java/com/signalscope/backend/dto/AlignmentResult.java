package com.signalscope.backend.dto;

import com.signalscope.backend.model.Alignment;

public record AlignmentResult(Alignment label, int score) {}
