package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.exception.PricingException;
import com.mouse.oneup.model.MarketBook;
import com.mouse.oneup.model.PriceQuote;
import com.mouse.oneup.model.PricingRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PriceComposer Tests")
class PriceComposerTest {

    private final PricingSettings settings = PricingSettings.builder()
            .calibrationVersion(CalibrationVersion.RATIO_PIECEWISE_V2)
            .build();
    private final PriceComposer composer = new PriceComposer(settings);

    private static PricingRequest request(Double margin) {
        return PricingRequest.builder()
                .eventId("EVT-9")
                .sourceIdentity("sporty")
                .markets(MarketBook.empty())
                .marginFraction(margin)
                .build();
    }

    @Test
    @DisplayName("quote_fairIsInverseProbability")
    void quote_fairIsInverseProbability() {
        PriceQuote quote = composer.quote(0.4, 0.0);

        assertThat(quote.fairOdds()).isEqualByComparingTo("2.50");
        assertThat(quote.marginOdds()).isEqualByComparingTo("2.50");
        assertThat(quote.fairOdds().scale()).isEqualTo(2);
    }

    @Test
    @DisplayName("quote_marginShortensOdds")
    void quote_marginShortensOdds() {
        PriceQuote quote = composer.quote(0.4, 0.05);

        assertThat(quote.marginOdds()).isEqualByComparingTo("2.38");
        assertThat(quote.marginOdds()).isLessThanOrEqualTo(quote.fairOdds());
    }

    @Test
    @DisplayName("quote_roundsHalfUp")
    void quote_roundsHalfUp() {
        // 1 / 0.32 = 3.125
        assertThat(composer.quote(0.32, 0.0).fairOdds()).isEqualByComparingTo("3.13");
    }

    @Test
    @DisplayName("quote_marginOddsFlooredAtOne")
    void quote_marginOddsFlooredAtOne() {
        PriceQuote quote = composer.quote(0.99, 0.5);

        assertThat(quote.marginOdds()).isEqualByComparingTo(BigDecimal.ONE);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -0.2, Double.NaN, Double.NEGATIVE_INFINITY})
    @DisplayName("quote_nonPositiveProbability_throws")
    void quote_nonPositiveProbability_throws(double p) {
        assertThatThrownBy(() -> composer.quote(p, 0.05)).isInstanceOf(PricingException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.01, 1.0, 1.5})
    @DisplayName("quote_marginOutOfRange_throws")
    void quote_marginOutOfRange_throws(double margin) {
        assertThatThrownBy(() -> composer.quote(0.5, margin)).isInstanceOf(PricingException.class);
    }

    @Test
    @DisplayName("margins_requestOverrideWins")
    void margins_requestOverrideWins() {
        PriceComposer sided = new PriceComposer(settings.toBuilder().homeMargin(0.03).awayMargin(0.07).build());

        assertThat(sided.homeMargin(request(null))).isEqualTo(0.03);
        assertThat(sided.awayMargin(request(null))).isEqualTo(0.07);
        assertThat(sided.homeMargin(request(0.1))).isEqualTo(0.1);
        assertThat(sided.awayMargin(request(0.1))).isEqualTo(0.1);
        assertThat(composer.homeMargin(request(null))).isEqualTo(0.05);
    }

    @Test
    @DisplayName("scale_usesConfiguredPrecision")
    void scale_usesConfiguredPrecision() {
        PriceComposer threeDp = new PriceComposer(settings.toBuilder().oddsScale(3).build());

        assertThat(threeDp.scale(3.4)).isEqualByComparingTo("3.400");
        assertThat(threeDp.scale(3.4).scale()).isEqualTo(3);
    }
}
