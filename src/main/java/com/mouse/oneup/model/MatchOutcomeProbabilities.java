package com.mouse.oneup.model;

public record MatchOutcomeProbabilities(double home, double draw, double away) {

    public double squaredDistance(MatchOutcomeProbabilities other) {
        double dh = home - other.home;
        double dd = draw - other.draw;
        double da = away - other.away;
        return dh * dh + dd * dd + da * da;
    }
}
