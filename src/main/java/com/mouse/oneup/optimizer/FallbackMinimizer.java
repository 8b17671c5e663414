package com.mouse.oneup.optimizer;

import com.mouse.oneup.interfaces.ScalarMinimizer;
import lombok.extern.slf4j.Slf4j;

import java.util.function.DoubleUnaryOperator;

/**
 * Runs the primary minimiser and falls back to the secondary one when the primary does
 * not converge to a finite point.
 */
@Slf4j
public class FallbackMinimizer implements ScalarMinimizer {

    private final ScalarMinimizer primary;
    private final ScalarMinimizer fallback;

    public FallbackMinimizer(ScalarMinimizer primary, ScalarMinimizer fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public MinimizationResult minimize(DoubleUnaryOperator objective, double lower, double upper) {
        MinimizationResult result = primary.minimize(objective, lower, upper);
        if (result.isUsable()) {
            return result;
        }
        log.debug("Primary minimiser did not converge on [{}, {}] after {} evaluations, using fallback",
                lower, upper, result.evaluations());
        return fallback.minimize(objective, lower, upper);
    }

    @Override
    public ScalarMinimizer withGridPoints(int gridPoints) {
        return new FallbackMinimizer(primary.withGridPoints(gridPoints), fallback.withGridPoints(gridPoints));
    }
}
