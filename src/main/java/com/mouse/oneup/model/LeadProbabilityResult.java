package com.mouse.oneup.model;

/**
 * Probabilities that each side is ever strictly ahead, and that the match ends level.
 * The three values overlap and need not sum to one.
 */
public record LeadProbabilityResult(double pHomeLead, double pAwayLead, double pLevelFullTime) {

    public LeadProbabilityResult withLeads(double home, double away) {
        return new LeadProbabilityResult(home, away, pLevelFullTime);
    }
}
