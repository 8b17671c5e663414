package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.exception.PricingException;
import com.mouse.oneup.model.PriceQuote;
import com.mouse.oneup.model.PricingRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Turns calibrated probabilities into fair and margin-adjusted decimal odds.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceComposer {

    private final PricingSettings settings;

    /**
     * @param probability    calibrated probability of the leg, in (0, 1]
     * @param marginFraction share taken off the fair odds, in [0, 1)
     * @throws PricingException if the probability is not a usable positive number or the margin is out of range
     */
    public PriceQuote quote(double probability, double marginFraction) {
        if (!(probability > 0) || !Double.isFinite(probability)) {
            throw new PricingException("Cannot price a leg with probability " + probability);
        }
        if (!PricingSettings.isMargin(marginFraction)) {
            throw new PricingException("Margin fraction must lie in [0, 1), got " + marginFraction);
        }
        double fair = 1.0 / probability;
        double withMargin = Math.max(1.0, fair * (1.0 - marginFraction));
        return new PriceQuote(scale(fair), scale(withMargin), marginFraction);
    }

    public double homeMargin(PricingRequest request) {
        return request.getMarginFraction() != null ? request.getMarginFraction() : settings.homeMarginOrDefault();
    }

    public double awayMargin(PricingRequest request) {
        return request.getMarginFraction() != null ? request.getMarginFraction() : settings.awayMarginOrDefault();
    }

    public BigDecimal scale(double odds) {
        return BigDecimal.valueOf(odds).setScale(settings.getOddsScale(), RoundingMode.HALF_UP);
    }
}
