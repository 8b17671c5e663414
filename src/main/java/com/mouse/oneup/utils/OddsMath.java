package com.mouse.oneup.utils;

import com.mouse.oneup.exception.PricingException;

/**
 * Conversions between decimal odds and probabilities.
 */
public final class OddsMath {

    public static final double LOGIT_EPSILON = 1e-9;
    private static final double MAX_EXPONENT = 20.0;

    private OddsMath() {
    }

    /**
     * Removes the bookmaker margin from a two-way market.
     *
     * @return the normalised probability of the first outcome
     */
    public static double devigTwoWay(double first, double second) {
        double q1 = 1.0 / first;
        double q2 = 1.0 / second;
        return q1 / (q1 + q2);
    }

    /**
     * Normalised implied probabilities of an n-way market, in input order.
     */
    public static double[] devig(double... odds) {
        if (odds == null || odds.length == 0) {
            throw new PricingException("No odds to de-vig");
        }
        double[] implied = new double[odds.length];
        double sum = 0.0;
        for (int i = 0; i < odds.length; i++) {
            if (!(odds[i] > 0) || !Double.isFinite(odds[i])) {
                throw new PricingException("Odds must be positive and finite: " + odds[i]);
            }
            implied[i] = 1.0 / odds[i];
            sum += implied[i];
        }
        for (int i = 0; i < implied.length; i++) {
            implied[i] /= sum;
        }
        return implied;
    }

    /**
     * Bookmaker overround of a market: sum of implied probabilities minus one.
     */
    public static double overround(double... odds) {
        double sum = 0.0;
        for (double odd : odds) {
            sum += 1.0 / odd;
        }
        return sum - 1.0;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static double logit(double p) {
        double q = clamp(p, LOGIT_EPSILON, 1.0 - LOGIT_EPSILON);
        return Math.log(q / (1.0 - q));
    }

    public static double invLogit(double z) {
        return 1.0 / (1.0 + Math.exp(-clamp(z, -MAX_EXPONENT, MAX_EXPONENT)));
    }
}
