package com.mouse.oneup.interfaces;

import com.mouse.oneup.enums.LeadEngineType;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;

/**
 * Computes the probability that each side is ever one goal ahead during the match.
 */
public interface LeadProbabilityEngine {

    /**
     * @param homeShareOverride probability that any given goal is scored by the home side;
     *                          when null the share implied by {@code rates} is used
     */
    LeadProbabilityResult estimate(RateEstimate rates, Double homeShareOverride);

    default LeadProbabilityResult estimate(RateEstimate rates) {
        return estimate(rates, null);
    }

    LeadEngineType type();
}
