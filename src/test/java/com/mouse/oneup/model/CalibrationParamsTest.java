package com.mouse.oneup.model;

import com.mouse.oneup.exception.PricingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Model value objects")
class CalibrationParamsTest {

    private final CalibrationParams params = new CalibrationParams("test",
            List.of(new RatioKnot(3.0, 0.8), new RatioKnot(1.0, 1.0)),
            List.of(new RatioKnot(1.0, 0.95)));

    @Test
    @DisplayName("interpolatesBetweenKnotsRegardlessOfInputOrder")
    void interpolatesBetweenKnotsRegardlessOfInputOrder() {
        assertThat(params.underdogMultiplier(2.0)).isCloseTo(0.9, within(1e-12));
    }

    @Test
    @DisplayName("flatOutsideKnots")
    void flatOutsideKnots() {
        assertThat(params.underdogMultiplier(0.5)).isEqualTo(1.0);
        assertThat(params.underdogMultiplier(10.0)).isEqualTo(0.8);
        assertThat(params.favoriteMultiplier(7.0)).isEqualTo(0.95);
    }

    @Test
    @DisplayName("rejectsEmptyCurve")
    void rejectsEmptyCurve() {
        assertThatThrownBy(() -> new CalibrationParams("bad", List.of(), List.of(new RatioKnot(1, 1))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rateEstimate_rejectsNonPositiveRates")
    void rateEstimate_rejectsNonPositiveRates() {
        assertThatThrownBy(() -> RateEstimate.of(0.0, 1.0)).isInstanceOf(PricingException.class);
        assertThatThrownBy(() -> RateEstimate.of(Double.NaN, 1.0)).isInstanceOf(PricingException.class);
    }

    @Test
    @DisplayName("rateEstimate_fromShareKeepsTotal")
    void rateEstimate_fromShareKeepsTotal() {
        RateEstimate rates = RateEstimate.fromShare(3.0, 0.6);

        assertThat(rates.rateHome()).isCloseTo(1.8, within(1e-12));
        assertThat(rates.rateAway()).isCloseTo(1.2, within(1e-12));
        assertThat(rates.homeShare()).isCloseTo(0.6, within(1e-12));
    }

    @Test
    @DisplayName("conditionalShare_goallessMarketFallsBackToHalf")
    void conditionalShare_goallessMarketFallsBackToHalf() {
        ConditionalShare share = new ConditionalShare(0.0, 1.0, 0.0, "sporty");

        assertThat(share.isGoalless()).isTrue();
        assertThat(share.homeShare()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("conditionalShare_conditionsOnAGoal")
    void conditionalShare_conditionsOnAGoal() {
        ConditionalShare share = new ConditionalShare(0.45, 0.10, 0.45, "sporty");

        assertThat(share.homeShare()).isCloseTo(0.5, within(1e-12));
    }
}
