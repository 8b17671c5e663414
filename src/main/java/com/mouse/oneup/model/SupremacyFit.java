package com.mouse.oneup.model;

import com.mouse.oneup.enums.FitMethod;

public record SupremacyFit(double supremacy, double loss, FitMethod method, RateEstimate rates) {
}
