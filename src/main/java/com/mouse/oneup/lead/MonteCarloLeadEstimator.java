package com.mouse.oneup.lead;

import com.mouse.oneup.enums.LeadEngineType;
import com.mouse.oneup.interfaces.LeadProbabilityEngine;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.utils.PoissonMath;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.SplittableRandom;
import java.util.stream.IntStream;

/**
 * Simulates matches with Poisson goal counts and uniform goal times and counts how
 * often each side is ever strictly ahead. Goalless simulations count for neither side.
 *
 * <p>Simulations run in fixed-size batches, in parallel, each batch on its own
 * {@link SplittableRandom} split from one root so a configured seed reproduces the run.
 */
@Slf4j
public class MonteCarloLeadEstimator implements LeadProbabilityEngine {

    private final int simulations;
    private final double matchMinutes;
    private final int batchSize;
    private final Long seed;

    public MonteCarloLeadEstimator(int simulations, double matchMinutes, int batchSize, Long seed) {
        if (simulations <= 0) {
            throw new IllegalArgumentException("Number of simulations must be positive, got " + simulations);
        }
        if (!(matchMinutes > 0) || batchSize <= 0) {
            throw new IllegalArgumentException("Match minutes and batch size must be positive");
        }
        this.simulations = simulations;
        this.matchMinutes = matchMinutes;
        this.batchSize = batchSize;
        this.seed = seed;
    }

    @Override
    public LeadProbabilityResult estimate(RateEstimate rates, Double homeShareOverride) {
        double rateHome = rates.rateHome();
        double rateAway = rates.rateAway();
        if (homeShareOverride != null) {
            rateHome = rates.rateTotal() * homeShareOverride;
            rateAway = rates.rateTotal() * (1.0 - homeShareOverride);
        }

        int batches = (simulations + batchSize - 1) / batchSize;
        SplittableRandom root = seed != null ? new SplittableRandom(seed) : new SplittableRandom();
        SplittableRandom[] streams = new SplittableRandom[batches];
        for (int b = 0; b < batches; b++) {
            streams[b] = root.split();
        }

        final double home = rateHome;
        final double away = rateAway;
        Tally tally = IntStream.range(0, batches)
                .parallel()
                .mapToObj(b -> runBatch(Math.min(batchSize, simulations - b * batchSize), home, away, streams[b]))
                .reduce(Tally.EMPTY, Tally::plus);

        log.debug("Simulated {} matches in {} batches (home={}, away={})", simulations, batches, home, away);
        return tally.toResult(simulations);
    }

    private Tally runBatch(int count, double rateHome, double rateAway, SplittableRandom random) {
        int[] homeGoals = new int[count];
        int[] awayGoals = new int[count];
        int maxHome = 0;
        int maxAway = 0;
        for (int i = 0; i < count; i++) {
            homeGoals[i] = PoissonMath.sample(rateHome, random);
            awayGoals[i] = PoissonMath.sample(rateAway, random);
            maxHome = Math.max(maxHome, homeGoals[i]);
            maxAway = Math.max(maxAway, awayGoals[i]);
        }

        double[] homeTimes = new double[maxHome];
        double[] awayTimes = new double[maxAway];
        long homeLead = 0;
        long awayLead = 0;
        long level = 0;
        for (int i = 0; i < count; i++) {
            int h = homeGoals[i];
            int a = awayGoals[i];
            if (h == a) {
                level++;
            }
            if (h + a == 0) {
                continue;
            }
            for (int g = 0; g < h; g++) {
                homeTimes[g] = random.nextDouble() * matchMinutes;
            }
            for (int g = 0; g < a; g++) {
                awayTimes[g] = random.nextDouble() * matchMinutes;
            }
            Arrays.sort(homeTimes, 0, h);
            Arrays.sort(awayTimes, 0, a);

            int hi = 0;
            int ai = 0;
            int diff = 0;
            boolean homeLed = false;
            boolean awayLed = false;
            while (hi < h || ai < a) {
                if (ai >= a || (hi < h && homeTimes[hi] <= awayTimes[ai])) {
                    diff++;
                    hi++;
                } else {
                    diff--;
                    ai++;
                }
                if (diff > 0) {
                    homeLed = true;
                } else if (diff < 0) {
                    awayLed = true;
                }
                if (homeLed && awayLed) {
                    break;
                }
            }
            if (homeLed) {
                homeLead++;
            }
            if (awayLed) {
                awayLead++;
            }
        }
        return new Tally(homeLead, awayLead, level);
    }

    /**
     * Straightforward one-match-at-a-time simulation, used to check the batched path.
     */
    public static LeadProbabilityResult simulateReference(double rateHome, double rateAway, int simulations,
                                                          double matchMinutes, SplittableRandom random) {
        if (simulations <= 0) {
            throw new IllegalArgumentException("Number of simulations must be positive, got " + simulations);
        }
        long homeLead = 0;
        long awayLead = 0;
        long level = 0;
        for (int s = 0; s < simulations; s++) {
            int h = PoissonMath.sample(rateHome, random);
            int a = PoissonMath.sample(rateAway, random);
            if (h == a) {
                level++;
            }
            double[] times = new double[h + a];
            Integer[] order = new Integer[h + a];
            for (int g = 0; g < h + a; g++) {
                times[g] = random.nextDouble() * matchMinutes;
                order[g] = g;
            }
            Arrays.sort(order, (x, y) -> Double.compare(times[x], times[y]));
            int diff = 0;
            boolean homeLed = false;
            boolean awayLed = false;
            for (int goal : order) {
                // indices below h are home goals
                diff += goal < h ? 1 : -1;
                homeLed |= diff > 0;
                awayLed |= diff < 0;
            }
            if (homeLed) {
                homeLead++;
            }
            if (awayLed) {
                awayLead++;
            }
        }
        return new Tally(homeLead, awayLead, level).toResult(simulations);
    }

    @Override
    public LeadEngineType type() {
        return LeadEngineType.MONTE_CARLO;
    }

    public int getSimulations() {
        return simulations;
    }

    private record Tally(long homeLead, long awayLead, long level) {

        static final Tally EMPTY = new Tally(0, 0, 0);

        Tally plus(Tally other) {
            return new Tally(homeLead + other.homeLead, awayLead + other.awayLead, level + other.level);
        }

        LeadProbabilityResult toResult(int simulations) {
            double n = simulations;
            return new LeadProbabilityResult(homeLead / n, awayLead / n, level / n);
        }
    }
}
