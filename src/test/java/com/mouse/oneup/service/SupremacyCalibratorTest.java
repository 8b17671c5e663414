package com.mouse.oneup.service;

import com.mouse.oneup.config.EngineConfig;
import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.enums.OptimizerType;
import com.mouse.oneup.model.MatchOutcomeProbabilities;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.model.SupremacyFit;
import com.mouse.oneup.utils.PoissonMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SupremacyCalibrator Tests")
class SupremacyCalibratorTest {

    private final PricingSettings settings = PricingSettings.builder()
            .calibrationVersion(CalibrationVersion.RATIO_PIECEWISE_V2)
            .build();

    private static SupremacyCalibrator calibratorFor(PricingSettings settings) {
        return new SupremacyCalibrator(settings, EngineConfig.minimizerFor(settings));
    }

    @ParameterizedTest(name = "home={0}, away={1}")
    @CsvSource({"1.8, 1.2", "1.0, 1.6", "1.35, 1.35", "2.6, 0.7"})
    @DisplayName("fit_recoversSupremacyFromConsistentMarket")
    void fit_recoversSupremacyFromConsistentMarket(double home, double away) {
        MatchOutcomeProbabilities market = PoissonMath.matchOutcome(home, away, 10);
        double total = home + away;

        SupremacyFit fit = calibratorFor(settings).fit(total, market, RateEstimate.of(total / 2, total / 2));

        assertThat(fit.method()).isEqualTo(FitMethod.BOUNDED);
        assertThat(fit.supremacy()).isCloseTo(home - away, within(1e-3));
        assertThat(fit.rates().rateTotal()).isEqualTo(total);
        assertThat(fit.loss()).isLessThan(1e-8);
    }

    @Test
    @DisplayName("fit_gridOptimizer_onGridResolution")
    void fit_gridOptimizer_onGridResolution() {
        PricingSettings grid = settings.toBuilder().optimizer(OptimizerType.GRID).build();
        MatchOutcomeProbabilities market = PoissonMath.matchOutcome(1.8, 1.2, 10);

        SupremacyFit fit = calibratorFor(grid).fit(3.0, market, RateEstimate.of(1.5, 1.5));

        assertThat(fit.method()).isEqualTo(FitMethod.GRID);
        // 201 points over [-2, 2]
        assertThat(fit.supremacy()).isCloseTo(0.6, within(0.02));
    }

    @Test
    @DisplayName("fit_disabled_keepsProportionalSplit")
    void fit_disabled_keepsProportionalSplit() {
        RateEstimate proportional = RateEstimate.of(1.4, 1.1);
        PricingSettings disabled = settings.toBuilder().supremacyEnabled(false).build();

        SupremacyFit fit = calibratorFor(disabled).fit(2.5, PoissonMath.matchOutcome(2.0, 0.5, 10), proportional);

        assertThat(fit.method()).isEqualTo(FitMethod.DISABLED);
        assertThat(fit.rates()).isEqualTo(proportional);
    }

    @Test
    @DisplayName("fit_lowTotal_boundsKeepBothRatesAboveFloor")
    void fit_lowTotal_boundsKeepBothRatesAboveFloor() {
        // a market far more lopsided than a total of 0.5 allows
        MatchOutcomeProbabilities market = new MatchOutcomeProbabilities(0.95, 0.04, 0.01);

        SupremacyFit fit = calibratorFor(settings).fit(0.5, market, RateEstimate.of(0.25, 0.25));

        assertThat(fit.rates().rateAway()).isGreaterThanOrEqualTo(settings.getRateLowerBound() - 1e-9);
        assertThat(fit.rates().rateHome()).isGreaterThan(fit.rates().rateAway());
    }
}
