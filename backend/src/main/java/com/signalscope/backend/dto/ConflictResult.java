package com.signalscope.backend.dto;

import com.signalscope.backend.model.Bias;
import com.signalscope.backend.model.ConflictType;

import java.util.List;

public record ConflictResult(
        boolean hasConflict,
        Bias technicalBias,
        String fundamentalVerdict,
        ConflictType conflictType,
        int confidenceAdjustment,
        String recommendation,
        List<String> details
) {}
