package com.mouse.oneup.utils;

import com.mouse.oneup.model.MatchOutcomeProbabilities;

import java.util.SplittableRandom;

/**
 * Poisson goal-count helpers shared by rate inference, supremacy fitting and the lead engines.
 */
public final class PoissonMath {

    private PoissonMath() {
    }

    public static double pmf(int k, double lambda) {
        if (k < 0) {
            return 0.0;
        }
        double p = Math.exp(-lambda);
        for (int i = 1; i <= k; i++) {
            p *= lambda / i;
        }
        return p;
    }

    /**
     * P(N = 0..maxGoals) for N ~ Poisson(lambda).
     */
    public static double[] pmfVector(double lambda, int maxGoals) {
        double[] p = new double[maxGoals + 1];
        p[0] = Math.exp(-lambda);
        for (int k = 1; k <= maxGoals; k++) {
            p[k] = p[k - 1] * lambda / k;
        }
        return p;
    }

    public static double cdf(int k, double lambda) {
        if (k < 0) {
            return 0.0;
        }
        double term = Math.exp(-lambda);
        double sum = term;
        for (int i = 1; i <= k; i++) {
            term *= lambda / i;
            sum += term;
        }
        return Math.min(1.0, sum);
    }

    /**
     * P(N >= threshold).
     */
    public static double tail(int threshold, double lambda) {
        if (threshold <= 0) {
            return 1.0;
        }
        return Math.max(0.0, 1.0 - cdf(threshold - 1, lambda));
    }

    /**
     * Goal count needed to win an over bet on {@code line}. The line is first rounded to
     * the nearest half (ties to even), so 2.25 settles like 2.0 and 2.75 like 3.0.
     */
    public static int thresholdForLine(double line) {
        double adjusted = Math.rint(line * 2.0) / 2.0;
        return (int) Math.floor(adjusted) + 1;
    }

    public static double effectiveOverProbability(double rate, double line) {
        return tail(thresholdForLine(line), rate);
    }

    /**
     * 1X2 probabilities of two independent Poisson scores summed over 0..maxGoals per
     * side. The result is not renormalised, so truncated mass is simply missing.
     */
    public static MatchOutcomeProbabilities matchOutcome(double rateHome, double rateAway, int maxGoals) {
        double[] home = pmfVector(rateHome, maxGoals);
        double[] away = pmfVector(rateAway, maxGoals);
        double pHome = 0.0;
        double pDraw = 0.0;
        double pAway = 0.0;
        for (int i = 0; i <= maxGoals; i++) {
            for (int j = 0; j <= maxGoals; j++) {
                double p = home[i] * away[j];
                if (i > j) {
                    pHome += p;
                } else if (i == j) {
                    pDraw += p;
                } else {
                    pAway += p;
                }
            }
        }
        return new MatchOutcomeProbabilities(pHome, pDraw, pAway);
    }

    public static double bothTeamsScore(double rateHome, double rateAway) {
        return (1.0 - Math.exp(-rateHome)) * (1.0 - Math.exp(-rateAway));
    }

    public static double noGoal(double rateTotal) {
        return Math.exp(-rateTotal);
    }

    /**
     * Knuth's multiplication method; fine for the small rates of football scoring.
     */
    public static int sample(double lambda, SplittableRandom random) {
        double limit = Math.exp(-lambda);
        int k = 0;
        double product = random.nextDouble();
        while (product > limit) {
            k++;
            product *= random.nextDouble();
        }
        return k;
    }

    /**
     * Binomial coefficient as a double; exact for the small n used here.
     */
    public static double binomial(int n, int k) {
        if (k < 0 || k > n) {
            return 0.0;
        }
        int m = Math.min(k, n - k);
        double result = 1.0;
        for (int i = 1; i <= m; i++) {
            result = result * (n - m + i) / i;
        }
        return result;
    }
}
