package com.mouse.oneup.optimizer;

import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.interfaces.ScalarMinimizer;

import java.util.function.DoubleUnaryOperator;

/**
 * Evaluates the objective on evenly spaced points, bounds included, and keeps the lowest.
 * Non-finite values are skipped.
 */
public class GridSearchMinimizer implements ScalarMinimizer {

    private final int points;

    public GridSearchMinimizer(int points) {
        if (points < 2) {
            throw new IllegalArgumentException("Grid needs at least 2 points, got " + points);
        }
        this.points = points;
    }

    public int getPoints() {
        return points;
    }

    @Override
    public MinimizationResult minimize(DoubleUnaryOperator objective, double lower, double upper) {
        if (!(lower <= upper)) {
            throw new IllegalArgumentException("Lower bound must not exceed upper bound: [" + lower + ", " + upper + "]");
        }
        double bestX = Double.NaN;
        double bestValue = Double.POSITIVE_INFINITY;
        double spacing = (upper - lower) / (points - 1);
        for (int i = 0; i < points; i++) {
            double x = i == points - 1 ? upper : lower + i * spacing;
            double value = objective.applyAsDouble(x);
            if (Double.isFinite(value) && value < bestValue) {
                bestValue = value;
                bestX = x;
            }
        }
        boolean found = Double.isFinite(bestX);
        return new MinimizationResult(bestX, bestValue, found, points, FitMethod.GRID);
    }

    @Override
    public ScalarMinimizer withGridPoints(int gridPoints) {
        return new GridSearchMinimizer(gridPoints);
    }
}
