package com.mouse.oneup.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Versioned coefficients of a rate-ratio correction. Each curve maps the strong/weak
 * rate ratio to a probability multiplier by linear interpolation between knots and is
 * flat outside the first and last knot.
 */
public record CalibrationParams(String version, List<RatioKnot> underdogCurve, List<RatioKnot> favoriteCurve) {

    public CalibrationParams {
        underdogCurve = sorted(underdogCurve);
        favoriteCurve = sorted(favoriteCurve);
        if (underdogCurve.isEmpty() || favoriteCurve.isEmpty()) {
            throw new IllegalArgumentException("Calibration " + version + " needs both curves");
        }
    }

    public double underdogMultiplier(double ratio) {
        return interpolate(underdogCurve, ratio);
    }

    public double favoriteMultiplier(double ratio) {
        return interpolate(favoriteCurve, ratio);
    }

    private static double interpolate(List<RatioKnot> curve, double ratio) {
        RatioKnot first = curve.get(0);
        if (ratio <= first.ratio()) {
            return first.multiplier();
        }
        for (int i = 1; i < curve.size(); i++) {
            RatioKnot right = curve.get(i);
            if (ratio <= right.ratio()) {
                RatioKnot left = curve.get(i - 1);
                double width = right.ratio() - left.ratio();
                if (width <= 0) {
                    return right.multiplier();
                }
                double t = (ratio - left.ratio()) / width;
                return left.multiplier() + t * (right.multiplier() - left.multiplier());
            }
        }
        return curve.get(curve.size() - 1).multiplier();
    }

    private static List<RatioKnot> sorted(List<RatioKnot> knots) {
        if (knots == null) {
            return Collections.emptyList();
        }
        List<RatioKnot> copy = new ArrayList<>(knots);
        copy.sort(Comparator.comparingDouble(RatioKnot::ratio));
        return Collections.unmodifiableList(copy);
    }
}
