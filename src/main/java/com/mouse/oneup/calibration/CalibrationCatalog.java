package com.mouse.oneup.calibration;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.exception.EngineConfigurationException;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.model.CalibrationParams;
import com.mouse.oneup.model.RatioKnot;

import java.util.List;

/**
 * Every calibration the engine knows. Only the version selected in configuration is
 * ever applied; the others stay available for comparison runs and regression tests.
 */
public final class CalibrationCatalog {

    /**
     * Fitted on 117 matches in January 2026. No correction up to a ratio of 1.15, then a
     * steeper underdog cut for lopsided matches and a favourite cut that grows with the ratio.
     */
    public static final CalibrationParams RATIO_PIECEWISE_V2 = new CalibrationParams(
            CalibrationVersion.RATIO_PIECEWISE_V2.getLabel(),
            List.of(
                    new RatioKnot(1.0, 1.0),
                    new RatioKnot(1.15, 1.0),
                    new RatioKnot(1.5, 0.97),
                    new RatioKnot(2.0, 0.92),
                    new RatioKnot(3.0, 0.82),
                    new RatioKnot(5.0, 0.75)),
            List.of(
                    new RatioKnot(1.0, 1.0),
                    new RatioKnot(1.15, 1.0),
                    new RatioKnot(2.0, 0.97),
                    new RatioKnot(4.0, 0.90)));

    /**
     * Earlier shape: a mild underdog cut bottoming out at 0.90 and a flat 0.97 for the favourite.
     */
    public static final CalibrationParams RATIO_PIECEWISE_V1 = new CalibrationParams(
            CalibrationVersion.RATIO_PIECEWISE_V1.getLabel(),
            List.of(
                    new RatioKnot(1.0, 1.0),
                    new RatioKnot(3.0, 0.92),
                    new RatioKnot(5.0, 0.90)),
            List.of(new RatioKnot(1.0, 0.97)));

    private CalibrationCatalog() {
    }

    public static ProbabilityCalibrator forVersion(CalibrationVersion version) {
        if (version == null) {
            throw new EngineConfigurationException("A calibration version must be selected explicitly");
        }
        return switch (version) {
            case IDENTITY -> new IdentityCalibrator();
            case RATIO_PIECEWISE_V1 -> new RatioPiecewiseCalibrator(version, RATIO_PIECEWISE_V1);
            case RATIO_PIECEWISE_V2 -> new RatioPiecewiseCalibrator(version, RATIO_PIECEWISE_V2);
            case LOGIT_LINEAR_V1 -> new LogitLinearCalibrator();
        };
    }
}
