package com.mouse.oneup.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CalibrationVersion {
    IDENTITY("identity"),
    RATIO_PIECEWISE_V1("ratio-piecewise-v1"),
    RATIO_PIECEWISE_V2("ratio-piecewise-v2"),
    LOGIT_LINEAR_V1("logit-linear-v1");

    private final String label;
}
