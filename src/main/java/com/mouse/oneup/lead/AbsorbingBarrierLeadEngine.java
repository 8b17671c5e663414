package com.mouse.oneup.lead;

import com.mouse.oneup.enums.LeadEngineType;
import com.mouse.oneup.interfaces.LeadProbabilityEngine;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.utils.OddsMath;
import com.mouse.oneup.utils.PoissonMath;

import java.util.Arrays;

/**
 * Exact lead probabilities. The total goal count is Poisson(rateTotal) and every goal
 * is independently a home goal with probability {@code p}; for each goal count the
 * chance of the score difference ever reaching +1 (or -1) is a random walk with an
 * absorbing barrier, solved by forward recursion.
 */
public class AbsorbingBarrierLeadEngine implements LeadProbabilityEngine {

    public static final int DEFAULT_MAX_GOALS = 15;

    static final double MIN_WEIGHT = 1e-15;
    static final double RESULT_EPSILON = 1e-9;

    private final int maxGoals;

    public AbsorbingBarrierLeadEngine() {
        this(DEFAULT_MAX_GOALS);
    }

    public AbsorbingBarrierLeadEngine(int maxGoals) {
        if (maxGoals < 1) {
            throw new IllegalArgumentException("maxGoals must be at least 1, got " + maxGoals);
        }
        this.maxGoals = maxGoals;
    }

    @Override
    public LeadProbabilityResult estimate(RateEstimate rates, Double homeShareOverride) {
        double total = rates.rateTotal();
        double p = homeShareOverride != null ? homeShareOverride : rates.homeShare();

        double homeLead = 0.0;
        double awayLead = 0.0;
        double level = 0.0;
        double weight = Math.exp(-total);
        for (int n = 0; n <= maxGoals; n++) {
            if (n > 0) {
                weight *= total / n;
            }
            if (weight < MIN_WEIGHT) {
                continue;
            }
            homeLead += weight * hitProbability(n, p, +1);
            awayLead += weight * hitProbability(n, p, -1);
            if (n % 2 == 0) {
                int half = n / 2;
                level += weight * PoissonMath.binomial(n, half) * Math.pow(p * (1.0 - p), half);
            }
        }
        return new LeadProbabilityResult(
                OddsMath.clamp(homeLead, RESULT_EPSILON, 1.0 - RESULT_EPSILON),
                OddsMath.clamp(awayLead, RESULT_EPSILON, 1.0 - RESULT_EPSILON),
                OddsMath.clamp(level, RESULT_EPSILON, 1.0 - RESULT_EPSILON));
    }

    /**
     * Probability that a walk of {@code n} steps, each +1 with probability {@code p},
     * touches {@code barrier} (+1 or -1) at least once.
     */
    public static double hitProbability(int n, double p, int barrier) {
        if (barrier == -1) {
            return hitProbability(n, 1.0 - p, +1);
        }
        if (barrier != +1) {
            throw new IllegalArgumentException("Barrier must be +1 or -1, got " + barrier);
        }
        if (n <= 0) {
            return 0.0;
        }
        // mass[i] is the unabsorbed probability of difference i - n
        double[] mass = new double[n + 1];
        double[] next = new double[n + 1];
        mass[n] = 1.0;
        double absorbed = 0.0;
        for (int step = 0; step < n; step++) {
            Arrays.fill(next, 0.0);
            for (int i = 0; i <= n; i++) {
                double m = mass[i];
                if (m < MIN_WEIGHT) {
                    continue;
                }
                if (i == n) {
                    absorbed += m * p;
                } else {
                    next[i + 1] += m * p;
                }
                if (i > 0) {
                    next[i - 1] += m * (1.0 - p);
                }
            }
            double[] swap = mass;
            mass = next;
            next = swap;
        }
        return absorbed;
    }

    @Override
    public LeadEngineType type() {
        return LeadEngineType.EXACT_DP;
    }

    public int getMaxGoals() {
        return maxGoals;
    }
}
