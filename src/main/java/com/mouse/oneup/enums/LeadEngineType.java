package com.mouse.oneup.enums;

public enum LeadEngineType {
    MONTE_CARLO,   // batched stochastic simulation
    EXACT_DP       // absorbing-barrier recursion over total goal counts
}
