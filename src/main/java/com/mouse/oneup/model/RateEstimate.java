package com.mouse.oneup.model;

import com.mouse.oneup.exception.PricingException;

public record RateEstimate(double rateHome, double rateAway, double rateTotal) {

    public RateEstimate {
        if (!(rateHome > 0) || !(rateAway > 0) || !(rateTotal > 0)) {
            throw new PricingException("Scoring rates must be positive: home=" + rateHome
                    + ", away=" + rateAway + ", total=" + rateTotal);
        }
    }

    public static RateEstimate of(double rateHome, double rateAway) {
        return new RateEstimate(rateHome, rateAway, rateHome + rateAway);
    }

    /**
     * Builds the split of {@code rateTotal} that gives the home side {@code homeShare}.
     */
    public static RateEstimate fromShare(double rateTotal, double homeShare) {
        return new RateEstimate(rateTotal * homeShare, rateTotal * (1.0 - homeShare), rateTotal);
    }

    public double homeShare() {
        return rateHome / (rateHome + rateAway);
    }

    public double supremacy() {
        return rateHome - rateAway;
    }
}
