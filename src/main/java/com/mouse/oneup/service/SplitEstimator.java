package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.ShareSource;
import com.mouse.oneup.model.ConditionalShare;
import com.mouse.oneup.model.MarketQuote;
import com.mouse.oneup.model.PricingRequest;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.model.SplitDecision;
import com.mouse.oneup.utils.OddsMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Splits the match scoring rate between the two sides, either proportionally to the
 * team-goals markets or from the first-team-to-score market of the mapped provider.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SplitEstimator {

    public static final double SHARE_EPSILON = 1e-6;

    private final PricingSettings settings;

    /**
     * Rescales the team rates so they add up to the match total. A non-positive team sum
     * leaves them unscaled.
     */
    public RateEstimate proportional(double rateTotal, double rateHome, double rateAway) {
        double sum = rateHome + rateAway;
        double factor = sum > 0 ? rateTotal / sum : 1.0;
        return new RateEstimate(rateHome * factor, rateAway * factor, rateTotal);
    }

    /**
     * First-team-to-score probabilities from the provider the request's source is mapped
     * to. Empty when the override is disabled, the source has no mapping, or the mapped
     * provider has no usable quote; quotes of other providers are never substituted.
     */
    public Optional<ConditionalShare> firstScorerShare(PricingRequest request) {
        if (!settings.isFirstScorerEnabled()) {
            return Optional.empty();
        }
        Optional<String> mapped = settings.firstScorerProviderFor(request.getSourceIdentity());
        if (mapped.isEmpty()) {
            log.debug("No first-scorer provider mapped for source '{}'", request.getSourceIdentity());
            return Optional.empty();
        }
        String provider = mapped.get();
        List<MarketQuote> quotes = request.getMarkets().validQuotes(MarketFamily.FIRST_TEAM_TO_SCORE);
        for (MarketQuote quote : quotes) {
            String quoteProvider = quote.provider() != null ? quote.provider() : request.getSourceIdentity();
            if (provider.equalsIgnoreCase(quoteProvider.trim())) {
                double[] p = OddsMath.devig(quote.odds(0), quote.odds(1), quote.odds(2));
                return Optional.of(new ConditionalShare(p[0], p[1], p[2], provider));
            }
        }
        log.debug("Source '{}' maps to first-scorer provider '{}' but no usable quote was found",
                request.getSourceIdentity(), provider);
        return Optional.empty();
    }

    /**
     * Final split handed to the lead engine. A first-scorer share, when present, replaces
     * the fitted split while keeping the match total.
     */
    public SplitDecision decide(RateEstimate fitted, ShareSource fittedSource,
                                Optional<ConditionalShare> firstScorer, List<String> degenerateNotes) {
        if (firstScorer.isEmpty()) {
            return new SplitDecision(fitted, fitted.homeShare(), fittedSource, null);
        }
        ConditionalShare share = firstScorer.get();
        if (share.isGoalless()) {
            degenerateNotes.add("first-scorer market prices no goal as certain; share set to 0.5");
        }
        double raw = share.homeShare();
        double clamped = OddsMath.clamp(raw, SHARE_EPSILON, 1.0 - SHARE_EPSILON);
        if (clamped != raw) {
            degenerateNotes.add("first-scorer share " + raw + " clamped to " + clamped);
        }
        RateEstimate rates = RateEstimate.fromShare(fitted.rateTotal(), clamped);
        return new SplitDecision(rates, clamped, ShareSource.FIRST_SCORER, share);
    }
}
