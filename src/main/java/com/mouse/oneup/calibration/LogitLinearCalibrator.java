package com.mouse.oneup.calibration;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.utils.OddsMath;

/**
 * {@code logit(p') = intercept + slope * logit(p)}, applied to each side independently.
 */
public class LogitLinearCalibrator implements ProbabilityCalibrator {

    public static final double DEFAULT_INTERCEPT = 0.17721692133648134;
    public static final double DEFAULT_SLOPE = 1.1581541486316087;

    private final double intercept;
    private final double slope;

    public LogitLinearCalibrator() {
        this(DEFAULT_INTERCEPT, DEFAULT_SLOPE);
    }

    public LogitLinearCalibrator(double intercept, double slope) {
        this.intercept = intercept;
        this.slope = slope;
    }

    @Override
    public CalibrationVersion version() {
        return CalibrationVersion.LOGIT_LINEAR_V1;
    }

    @Override
    public LeadProbabilityResult calibrate(LeadProbabilityResult raw, RateEstimate rates) {
        return raw.withLeads(apply(raw.pHomeLead()), apply(raw.pAwayLead()));
    }

    double apply(double p) {
        double calibrated = OddsMath.invLogit(intercept + slope * OddsMath.logit(p));
        return OddsMath.clamp(calibrated, PROBABILITY_EPSILON, 1.0 - PROBABILITY_EPSILON);
    }
}
