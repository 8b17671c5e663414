package com.mouse.oneup.enums;

public enum FitMethod {
    CLOSED_FORM,
    BOUNDED,
    GRID,
    FALLBACK_CONSTANT,
    DISABLED
}
