package com.mouse.oneup.model;

import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.ShareSource;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Intermediate values of one pricing run, kept so a record can be audited without
 * recomputing it.
 */
@Value
@Builder(toBuilder = true)
public class PricingDiagnostics {

    double rawHomeLead;
    double rawAwayLead;

    double homeShare;
    ShareSource shareSource;
    String shareProvider;

    Double supremacy;
    FitMethod supremacyMethod;
    Double supremacyLoss;

    double proportionalRateHome;
    double proportionalRateAway;

    @Singular
    Map<MarketFamily, FitMethod> fitMethods;
    @Singular
    Map<MarketFamily, Integer> rejectedLines;

    MatchOutcomeProbabilities marketOutcome;
    MatchOutcomeProbabilities modelOutcome;

    Double bttsMarket;
    Double bttsModel;
    Double noGoalMarket;
    Double noGoalModel;

    String calibrationVersion;

    @Singular
    List<String> degenerateNotes;

    public boolean isDegenerate() {
        return !degenerateNotes.isEmpty();
    }
}
