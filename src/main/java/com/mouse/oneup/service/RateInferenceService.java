package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.interfaces.ScalarMinimizer;
import com.mouse.oneup.model.MarketQuote;
import com.mouse.oneup.model.RateFit;
import com.mouse.oneup.optimizer.MinimizationResult;
import com.mouse.oneup.utils.OddsMath;
import com.mouse.oneup.utils.PoissonMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * Infers a Poisson scoring rate from the over/under lines of one goals market.
 */
@Slf4j
@Service
public class RateInferenceService {

    private final PricingSettings settings;
    private final ScalarMinimizer minimizer;

    public RateInferenceService(PricingSettings settings, ScalarMinimizer minimizer) {
        this.settings = settings;
        this.minimizer = minimizer.withGridPoints(settings.getInferenceGridPoints());
    }

    /**
     * Fits the rate of a lined family. One valid line is solved by bisection, several
     * by least squares over all of them, none falls back to the configured constant.
     */
    public RateFit inferRate(MarketFamily family, List<MarketQuote> quotes) {
        List<MarketQuote> valid = new ArrayList<>();
        int rejected = 0;
        for (MarketQuote quote : quotes) {
            if (quote != null && quote.isValid(2, true)) {
                valid.add(quote);
            } else {
                rejected++;
            }
        }
        if (rejected > 0) {
            log.debug("{}: dropped {} unusable line(s)", family, rejected);
        }

        if (valid.isEmpty()) {
            log.warn("{}: no valid line, using fallback rate {}", family, settings.getFallbackRate());
            return new RateFit(settings.getFallbackRate(), FitMethod.FALLBACK_CONSTANT, 0, rejected);
        }
        if (valid.size() == 1) {
            MarketQuote only = valid.get(0);
            double rate = rateFromSingleLine(only.line(), OddsMath.devigTwoWay(only.odds(0), only.odds(1)));
            return new RateFit(rate, FitMethod.CLOSED_FORM, 1, rejected);
        }

        DoubleUnaryOperator loss = squaredErrorLoss(valid);
        MinimizationResult result = minimizer.minimize(loss, settings.getRateLowerBound(), settings.getRateUpperBound());
        if (!result.isUsable() || !(result.argMin() > 0)) {
            log.warn("{}: least-squares fit failed over {} lines, using fallback rate {}",
                    family, valid.size(), settings.getFallbackRate());
            return new RateFit(settings.getFallbackRate(), FitMethod.FALLBACK_CONSTANT, valid.size(), rejected);
        }
        log.debug("{}: fitted rate {} from {} lines ({}, loss={})",
                family, result.argMin(), valid.size(), result.method(), result.value());
        return new RateFit(result.argMin(), result.method(), valid.size(), rejected);
    }

    /**
     * Rate whose effective over probability at {@code line} equals {@code pOver}.
     * The upper bracket is doubled until it covers the target, then bisected.
     */
    public double rateFromSingleLine(double line, double pOver) {
        double low = settings.getRateLowerBound();
        double high = settings.getSingleLineUpperBound();
        for (int i = 0; i < settings.getBracketExpansions(); i++) {
            if (PoissonMath.effectiveOverProbability(high, line) >= pOver) {
                break;
            }
            high *= 2.0;
        }
        for (int i = 0; i < settings.getBisectionSteps(); i++) {
            double mid = 0.5 * (low + high);
            if (PoissonMath.effectiveOverProbability(mid, line) < pOver) {
                low = mid;
            } else {
                high = mid;
            }
        }
        return 0.5 * (low + high);
    }

    static DoubleUnaryOperator squaredErrorLoss(List<MarketQuote> lines) {
        int n = lines.size();
        double[] lineValues = new double[n];
        double[] targets = new double[n];
        for (int i = 0; i < n; i++) {
            MarketQuote quote = lines.get(i);
            lineValues[i] = quote.line();
            targets[i] = OddsMath.devigTwoWay(quote.odds(0), quote.odds(1));
        }
        return rate -> {
            double error = 0.0;
            for (int i = 0; i < n; i++) {
                double diff = PoissonMath.effectiveOverProbability(rate, lineValues[i]) - targets[i];
                error += diff * diff;
            }
            return error;
        };
    }
}
