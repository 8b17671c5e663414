package com.mouse.oneup.enums;

public enum OptimizerType {
    BOUNDED,  // Brent bounded minimisation, grid search when it does not converge
    GRID      // deterministic grid search only
}
