package com.mouse.oneup.config;

import com.mouse.oneup.enums.BookMaker;
import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.enums.LeadEngineType;
import com.mouse.oneup.enums.OptimizerType;
import com.mouse.oneup.exception.EngineConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable engine settings, built once at startup and shared by every component.
 */
@Value
@Builder(toBuilder = true)
public class PricingSettings {

    @Builder.Default
    String engineName = "oneup";
    @Builder.Default
    LeadEngineType leadEngine = LeadEngineType.EXACT_DP;
    @Builder.Default
    OptimizerType optimizer = OptimizerType.BOUNDED;
    CalibrationVersion calibrationVersion;

    // Monte Carlo
    @Builder.Default
    int simulations = 30_000;
    @Builder.Default
    double matchMinutes = 95.0;
    @Builder.Default
    int batchSize = 4_096;
    Long seed;

    // Absorbing-barrier DP
    @Builder.Default
    int dpMaxGoals = 15;

    // Rate inference
    @Builder.Default
    double rateLowerBound = 0.01;
    @Builder.Default
    double rateUpperBound = 8.0;
    @Builder.Default
    double singleLineUpperBound = 6.0;
    @Builder.Default
    int bracketExpansions = 20;
    @Builder.Default
    int bisectionSteps = 50;
    @Builder.Default
    double fallbackRate = 1.8;
    @Builder.Default
    int inferenceGridPoints = 400;

    // Supremacy
    @Builder.Default
    boolean supremacyEnabled = true;
    @Builder.Default
    double supremacyBound = 2.0;
    @Builder.Default
    int supremacyGoalGrid = 10;
    @Builder.Default
    int supremacyGridPoints = 201;

    // First team to score
    @Builder.Default
    boolean firstScorerEnabled = true;
    @Builder.Default
    Map<String, String> firstScorerProviders = defaultFirstScorerProviders();

    // Margins
    @Builder.Default
    double defaultMargin = 0.05;
    Double homeMargin;
    Double awayMargin;
    @Builder.Default
    int oddsScale = 2;

    @Builder.Default
    int runnerWorkers = Runtime.getRuntime().availableProcessors();

    public static Map<String, String> defaultFirstScorerProviders() {
        return Map.of(
                BookMaker.SPORTY_BET.getCode(), BookMaker.SPORTY_BET.getCode(),
                BookMaker.BET9JA.getCode(), BookMaker.BET9JA.getCode(),
                BookMaker.BET_PAWA.getCode(), BookMaker.SPORTY_BET.getCode());
    }

    /**
     * {@code <engineName>/<leadStrategy>/<calibrationVersion>}, e.g. {@code oneup/exact-dp/ratio-piecewise-v2}.
     */
    public String engineVersion() {
        return engineVersion(engineName, leadEngine, calibrationVersion);
    }

    public static String engineVersion(String engineName, LeadEngineType leadEngine, CalibrationVersion calibration) {
        String strategy = leadEngine.name().toLowerCase(Locale.ROOT).replace('_', '-');
        return engineName + "/" + strategy + "/" + calibration.getLabel();
    }

    /**
     * Provider whose first-team-to-score price the given source uses, if any.
     */
    public Optional<String> firstScorerProviderFor(String sourceIdentity) {
        if (sourceIdentity == null || firstScorerProviders == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(firstScorerProviders.get(sourceIdentity.trim().toLowerCase(Locale.ROOT)));
    }

    public double homeMarginOrDefault() {
        return homeMargin != null ? homeMargin : defaultMargin;
    }

    public double awayMarginOrDefault() {
        return awayMargin != null ? awayMargin : defaultMargin;
    }

    /**
     * @return this instance when every setting is usable
     * @throws EngineConfigurationException listing every invalid setting
     */
    public PricingSettings validate() {
        List<String> problems = new ArrayList<>();
        if (engineName == null || engineName.isBlank()) {
            problems.add("engine-name must not be blank");
        }
        if (leadEngine == null) {
            problems.add("lead-engine is required");
        }
        if (optimizer == null) {
            problems.add("optimizer is required");
        }
        if (calibrationVersion == null) {
            problems.add("calibration-version must be selected explicitly");
        }
        if (simulations <= 0) {
            problems.add("simulation.simulations must be positive");
        }
        if (!(matchMinutes > 0)) {
            problems.add("simulation.match-minutes must be positive");
        }
        if (batchSize <= 0) {
            problems.add("simulation.batch-size must be positive");
        }
        if (dpMaxGoals < 1) {
            problems.add("dp.max-goals must be at least 1");
        }
        if (!(rateLowerBound > 0) || !(rateUpperBound > rateLowerBound)) {
            problems.add("inference rate bounds must satisfy 0 < lower < upper");
        }
        if (!(singleLineUpperBound > rateLowerBound)) {
            problems.add("inference.single-line-upper-bound must exceed the lower bound");
        }
        if (!(fallbackRate > 0)) {
            problems.add("inference.fallback-rate must be positive");
        }
        if (inferenceGridPoints < 2 || supremacyGridPoints < 2) {
            problems.add("grid point counts must be at least 2");
        }
        if (bisectionSteps < 1 || bracketExpansions < 0) {
            problems.add("bisection budgets must be non-negative");
        }
        if (!(supremacyBound > 0) || supremacyGoalGrid < 1) {
            problems.add("supremacy bound and goal grid must be positive");
        }
        if (!isMargin(defaultMargin) || (homeMargin != null && !isMargin(homeMargin))
                || (awayMargin != null && !isMargin(awayMargin))) {
            problems.add("margins must lie in [0, 1)");
        }
        if (oddsScale < 0) {
            problems.add("margin.odds-scale must not be negative");
        }
        if (runnerWorkers < 1) {
            problems.add("runner.workers must be at least 1");
        }
        if (!problems.isEmpty()) {
            throw new EngineConfigurationException("Invalid 1UP engine configuration: " + String.join("; ", problems));
        }
        return this;
    }

    public static boolean isMargin(double value) {
        return value >= 0.0 && value < 1.0;
    }
}
