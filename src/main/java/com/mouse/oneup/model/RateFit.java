package com.mouse.oneup.model;

import com.mouse.oneup.enums.FitMethod;

/**
 * Rate inferred from one market family together with how it was obtained.
 */
public record RateFit(double rate, FitMethod method, int linesUsed, int linesRejected) {
}
