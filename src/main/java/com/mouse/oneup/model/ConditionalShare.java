package com.mouse.oneup.model;

/**
 * De-vigged first-team-to-score probabilities and the provider they came from.
 */
public record ConditionalShare(double pHomeFirst, double pNoGoal, double pAwayFirst, String provider) {

    private static final double MIN_GOAL_PROBABILITY = 1e-9;

    /**
     * P(home scores first | at least one goal), or 0.5 when a goal is practically impossible.
     */
    public double homeShare() {
        double pGoal = 1.0 - pNoGoal;
        if (pGoal <= MIN_GOAL_PROBABILITY) {
            return 0.5;
        }
        return pHomeFirst / pGoal;
    }

    public boolean isGoalless() {
        return 1.0 - pNoGoal <= MIN_GOAL_PROBABILITY;
    }
}
