package com.mouse.oneup.calibration;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;

public class IdentityCalibrator implements ProbabilityCalibrator {

    @Override
    public CalibrationVersion version() {
        return CalibrationVersion.IDENTITY;
    }

    @Override
    public LeadProbabilityResult calibrate(LeadProbabilityResult raw, RateEstimate rates) {
        return raw;
    }
}
