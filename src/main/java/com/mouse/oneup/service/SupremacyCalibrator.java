package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.interfaces.ScalarMinimizer;
import com.mouse.oneup.model.MatchOutcomeProbabilities;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.model.SupremacyFit;
import com.mouse.oneup.optimizer.MinimizationResult;
import com.mouse.oneup.utils.PoissonMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fits the goal supremacy {@code s = rateHome - rateAway} at a fixed match total so the
 * independent-Poisson 1X2 probabilities match the de-vigged 1X2 market.
 */
@Slf4j
@Service
public class SupremacyCalibrator {

    private final PricingSettings settings;
    private final ScalarMinimizer minimizer;

    public SupremacyCalibrator(PricingSettings settings, ScalarMinimizer minimizer) {
        this.settings = settings;
        this.minimizer = minimizer.withGridPoints(settings.getSupremacyGridPoints());
    }

    public boolean isEnabled() {
        return settings.isSupremacyEnabled();
    }

    /**
     * @param proportional split used when fitting is disabled or impossible
     */
    public SupremacyFit fit(double rateTotal, MatchOutcomeProbabilities market, RateEstimate proportional) {
        if (!settings.isSupremacyEnabled()) {
            return new SupremacyFit(proportional.supremacy(), Double.NaN, FitMethod.DISABLED, proportional);
        }
        // both rates must stay at or above the floor
        double floor = settings.getRateLowerBound();
        double reach = Math.min(settings.getSupremacyBound(), rateTotal - 2.0 * floor);
        if (!(reach > 0)) {
            log.warn("Match total {} too small to fit supremacy, keeping proportional split", rateTotal);
            return new SupremacyFit(proportional.supremacy(), Double.NaN, FitMethod.FALLBACK_CONSTANT, proportional);
        }

        int goalGrid = settings.getSupremacyGoalGrid();
        MinimizationResult result = minimizer.minimize(
                s -> PoissonMath.matchOutcome((rateTotal + s) / 2.0, (rateTotal - s) / 2.0, goalGrid)
                        .squaredDistance(market),
                -reach, reach);
        if (!result.isUsable()) {
            log.warn("Supremacy fit failed for total {}, keeping proportional split", rateTotal);
            return new SupremacyFit(proportional.supremacy(), Double.NaN, FitMethod.FALLBACK_CONSTANT, proportional);
        }
        double s = result.argMin();
        RateEstimate rates = new RateEstimate((rateTotal + s) / 2.0, (rateTotal - s) / 2.0, rateTotal);
        log.debug("Supremacy {} (loss={}, method={}) -> home={}, away={}",
                s, result.value(), result.method(), rates.rateHome(), rates.rateAway());
        return new SupremacyFit(s, result.value(), result.method(), rates);
    }
}
