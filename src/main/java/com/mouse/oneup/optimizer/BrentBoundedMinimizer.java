package com.mouse.oneup.optimizer;

import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.interfaces.ScalarMinimizer;

import java.util.function.DoubleUnaryOperator;

/**
 * Brent's bounded minimisation: golden-section steps with parabolic interpolation when
 * the last three points allow it. The result is flagged as not converged when the
 * evaluation budget runs out or the objective stops being finite.
 */
public class BrentBoundedMinimizer implements ScalarMinimizer {

    public static final double DEFAULT_TOLERANCE = 1e-5;
    public static final int DEFAULT_MAX_EVALUATIONS = 500;

    private static final double SQRT_EPS = Math.sqrt(2.2e-16);
    private static final double GOLDEN = 0.5 * (3.0 - Math.sqrt(5.0));

    private final double tolerance;
    private final int maxEvaluations;

    public BrentBoundedMinimizer() {
        this(DEFAULT_TOLERANCE, DEFAULT_MAX_EVALUATIONS);
    }

    public BrentBoundedMinimizer(double tolerance, int maxEvaluations) {
        if (!(tolerance > 0) || maxEvaluations < 1) {
            throw new IllegalArgumentException("Invalid Brent settings: tolerance=" + tolerance
                    + ", maxEvaluations=" + maxEvaluations);
        }
        this.tolerance = tolerance;
        this.maxEvaluations = maxEvaluations;
    }

    @Override
    public MinimizationResult minimize(DoubleUnaryOperator objective, double lower, double upper) {
        if (!(lower < upper)) {
            throw new IllegalArgumentException("Lower bound must be below upper bound: [" + lower + ", " + upper + "]");
        }
        double a = lower;
        double b = upper;
        double farthest = a + GOLDEN * (b - a);
        double middle = farthest;
        double best = farthest;
        double step = 0.0;
        double previousStep = 0.0;

        double fBest = objective.applyAsDouble(best);
        int evaluations = 1;
        double fFarthest = fBest;
        double fMiddle = fBest;

        double midpoint = 0.5 * (a + b);
        double tol1 = SQRT_EPS * Math.abs(best) + tolerance / 3.0;
        double tol2 = 2.0 * tol1;
        boolean converged = true;

        while (Math.abs(best - midpoint) > tol2 - 0.5 * (b - a)) {
            if (!Double.isFinite(fBest)) {
                converged = false;
                break;
            }
            boolean golden = true;
            if (Math.abs(previousStep) > tol1) {
                golden = false;
                double r = (best - middle) * (fBest - fFarthest);
                double q = (best - farthest) * (fBest - fMiddle);
                double p = (best - farthest) * q - (best - middle) * r;
                q = 2.0 * (q - r);
                if (q > 0.0) {
                    p = -p;
                }
                q = Math.abs(q);
                r = previousStep;
                previousStep = step;

                if (Math.abs(p) < Math.abs(0.5 * q * r) && p > q * (a - best) && p < q * (b - best)) {
                    step = p / q;
                    double x = best + step;
                    if (x - a < tol2 || b - x < tol2) {
                        step = tol1 * signOrOne(midpoint - best);
                    }
                } else {
                    golden = true;
                }
            }
            if (golden) {
                previousStep = best >= midpoint ? a - best : b - best;
                step = GOLDEN * previousStep;
            }

            double x = best + signOrOne(step) * Math.max(Math.abs(step), tol1);
            double fx = objective.applyAsDouble(x);
            evaluations++;

            if (fx <= fBest) {
                if (x >= best) {
                    a = best;
                } else {
                    b = best;
                }
                farthest = middle;
                fFarthest = fMiddle;
                middle = best;
                fMiddle = fBest;
                best = x;
                fBest = fx;
            } else {
                if (x < best) {
                    a = x;
                } else {
                    b = x;
                }
                if (fx <= fMiddle || middle == best) {
                    farthest = middle;
                    fFarthest = fMiddle;
                    middle = x;
                    fMiddle = fx;
                } else if (fx <= fFarthest || farthest == best || farthest == middle) {
                    farthest = x;
                    fFarthest = fx;
                }
            }

            midpoint = 0.5 * (a + b);
            tol1 = SQRT_EPS * Math.abs(best) + tolerance / 3.0;
            tol2 = 2.0 * tol1;

            if (evaluations >= maxEvaluations) {
                converged = false;
                break;
            }
        }
        return new MinimizationResult(best, fBest, converged && Double.isFinite(fBest), evaluations, FitMethod.BOUNDED);
    }

    private static double signOrOne(double value) {
        return value < 0 ? -1.0 : 1.0;
    }
}
