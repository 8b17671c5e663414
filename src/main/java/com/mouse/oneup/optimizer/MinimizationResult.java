package com.mouse.oneup.optimizer;

import com.mouse.oneup.enums.FitMethod;

public record MinimizationResult(double argMin, double value, boolean converged, int evaluations, FitMethod method) {

    public boolean isUsable() {
        return converged && Double.isFinite(argMin) && Double.isFinite(value);
    }
}
