package com.mouse.oneup.config;

import com.mouse.oneup.calibration.CalibrationCatalog;
import com.mouse.oneup.interfaces.LeadProbabilityEngine;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.interfaces.ScalarMinimizer;
import com.mouse.oneup.lead.AbsorbingBarrierLeadEngine;
import com.mouse.oneup.lead.MonteCarloLeadEstimator;
import com.mouse.oneup.optimizer.BrentBoundedMinimizer;
import com.mouse.oneup.optimizer.FallbackMinimizer;
import com.mouse.oneup.optimizer.GridSearchMinimizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Resolves the configured strategies once at startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public PricingSettings pricingSettings(EngineProperties properties) {
        PricingSettings settings = properties.toSettings();
        log.info("🚀 1UP engine configured | Version: {} | Optimizer: {} | Workers: {}",
                settings.engineVersion(), settings.getOptimizer(), settings.getRunnerWorkers());
        return settings;
    }

    @Bean
    public ScalarMinimizer scalarMinimizer(PricingSettings settings) {
        return minimizerFor(settings);
    }

    @Bean
    public LeadProbabilityEngine leadProbabilityEngine(PricingSettings settings) {
        return leadEngineFor(settings);
    }

    @Bean
    public ProbabilityCalibrator probabilityCalibrator(PricingSettings settings) {
        return CalibrationCatalog.forVersion(settings.getCalibrationVersion());
    }

    public static ScalarMinimizer minimizerFor(PricingSettings settings) {
        GridSearchMinimizer grid = new GridSearchMinimizer(settings.getInferenceGridPoints());
        return switch (settings.getOptimizer()) {
            case BOUNDED -> new FallbackMinimizer(new BrentBoundedMinimizer(), grid);
            case GRID -> grid;
        };
    }

    public static LeadProbabilityEngine leadEngineFor(PricingSettings settings) {
        return switch (settings.getLeadEngine()) {
            case EXACT_DP -> new AbsorbingBarrierLeadEngine(settings.getDpMaxGoals());
            case MONTE_CARLO -> new MonteCarloLeadEstimator(settings.getSimulations(), settings.getMatchMinutes(),
                    settings.getBatchSize(), settings.getSeed());
        };
    }
}
