package com.mouse.oneup.interfaces;

import com.mouse.oneup.optimizer.MinimizationResult;

import java.util.function.DoubleUnaryOperator;

/**
 * Minimises a one-dimensional function on a closed interval.
 */
public interface ScalarMinimizer {

    MinimizationResult minimize(DoubleUnaryOperator objective, double lower, double upper);

    /**
     * Same minimiser with a different grid resolution where it has one; minimisers
     * without a grid return themselves.
     */
    default ScalarMinimizer withGridPoints(int gridPoints) {
        return this;
    }
}
