package com.mouse.oneup.interfaces;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;

/**
 * Empirical correction of raw lead probabilities.
 */
public interface ProbabilityCalibrator {

    double PROBABILITY_EPSILON = 1e-6;

    CalibrationVersion version();

    /**
     * @param rates the rates the raw probabilities were computed from
     */
    LeadProbabilityResult calibrate(LeadProbabilityResult raw, RateEstimate rates);
}
