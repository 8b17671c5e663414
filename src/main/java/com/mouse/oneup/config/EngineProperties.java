package com.mouse.oneup.config;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.enums.LeadEngineType;
import com.mouse.oneup.enums.OptimizerType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Bound from {@code oneup.engine.*}. Only read once, by {@link #toSettings()}.
 */
@Data
@ConfigurationProperties(prefix = "oneup.engine")
public class EngineProperties {

    private String name = "oneup";

    private LeadEngineType leadEngine = LeadEngineType.EXACT_DP;

    private OptimizerType optimizer = OptimizerType.BOUNDED;

    /** Required. No default so the applied correction is always a deliberate choice. */
    private CalibrationVersion calibrationVersion;

    private Simulation simulation = new Simulation();
    private Dp dp = new Dp();
    private Inference inference = new Inference();
    private Supremacy supremacy = new Supremacy();
    private FirstScorer firstScorer = new FirstScorer();
    private Margin margin = new Margin();
    private Runner runner = new Runner();

    @Data
    public static class Simulation {
        private int simulations = 30_000;
        private double matchMinutes = 95.0;
        private int batchSize = 4_096;
        /** Fixed seed for reproducible runs; random when unset. */
        private Long seed;
    }

    @Data
    public static class Dp {
        private int maxGoals = 15;
    }

    @Data
    public static class Inference {
        private double rateLowerBound = 0.01;
        private double rateUpperBound = 8.0;
        private double singleLineUpperBound = 6.0;
        private int bracketExpansions = 20;
        private int bisectionSteps = 50;
        private double fallbackRate = 1.8;
        private int gridPoints = 400;
    }

    @Data
    public static class Supremacy {
        private boolean enabled = true;
        private double bound = 2.0;
        private int goalGrid = 10;
        private int gridPoints = 201;
    }

    @Data
    public static class FirstScorer {
        private boolean enabled = true;
        /** Source identity to the provider whose first-team-to-score price it uses. */
        private Map<String, String> providers = new LinkedHashMap<>(PricingSettings.defaultFirstScorerProviders());
    }

    @Data
    public static class Margin {
        private double defaultMargin = 0.05;
        private Double home;
        private Double away;
        private int oddsScale = 2;
    }

    @Data
    public static class Runner {
        private int workers = Runtime.getRuntime().availableProcessors();
    }

    /**
     * @throws com.mouse.oneup.exception.EngineConfigurationException if any setting is invalid
     */
    public PricingSettings toSettings() {
        Map<String, String> providers = new LinkedHashMap<>();
        firstScorer.getProviders().forEach((source, provider) ->
                providers.put(source.trim().toLowerCase(Locale.ROOT), provider.trim().toLowerCase(Locale.ROOT)));

        return PricingSettings.builder()
                .engineName(name)
                .leadEngine(leadEngine)
                .optimizer(optimizer)
                .calibrationVersion(calibrationVersion)
                .simulations(simulation.getSimulations())
                .matchMinutes(simulation.getMatchMinutes())
                .batchSize(simulation.getBatchSize())
                .seed(simulation.getSeed())
                .dpMaxGoals(dp.getMaxGoals())
                .rateLowerBound(inference.getRateLowerBound())
                .rateUpperBound(inference.getRateUpperBound())
                .singleLineUpperBound(inference.getSingleLineUpperBound())
                .bracketExpansions(inference.getBracketExpansions())
                .bisectionSteps(inference.getBisectionSteps())
                .fallbackRate(inference.getFallbackRate())
                .inferenceGridPoints(inference.getGridPoints())
                .supremacyEnabled(supremacy.isEnabled())
                .supremacyBound(supremacy.getBound())
                .supremacyGoalGrid(supremacy.getGoalGrid())
                .supremacyGridPoints(supremacy.getGridPoints())
                .firstScorerEnabled(firstScorer.isEnabled())
                .firstScorerProviders(Map.copyOf(providers))
                .defaultMargin(margin.getDefaultMargin())
                .homeMargin(margin.getHome())
                .awayMargin(margin.getAway())
                .oddsScale(margin.getOddsScale())
                .runnerWorkers(runner.getWorkers())
                .build()
                .validate();
    }
}
