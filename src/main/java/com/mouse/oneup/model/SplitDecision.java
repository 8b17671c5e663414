package com.mouse.oneup.model;

import com.mouse.oneup.enums.ShareSource;

/**
 * The rates handed to the lead engine and where their home/away split came from.
 *
 * @param firstScorer the first-scorer probabilities used for the override, null when none applied
 */
public record SplitDecision(RateEstimate rates, double homeShare, ShareSource source, ConditionalShare firstScorer) {

    public boolean hasShareOverride() {
        return source == ShareSource.FIRST_SCORER;
    }
}
