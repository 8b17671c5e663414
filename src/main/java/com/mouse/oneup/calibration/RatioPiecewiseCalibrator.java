package com.mouse.oneup.calibration;

import com.mouse.oneup.enums.CalibrationVersion;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.model.CalibrationParams;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.utils.OddsMath;
import lombok.extern.slf4j.Slf4j;

/**
 * Scales the weaker side's lead probability by an underdog multiplier and the stronger
 * side's by a favourite multiplier, both read from the rate ratio.
 */
@Slf4j
public class RatioPiecewiseCalibrator implements ProbabilityCalibrator {

    /** Rates below this are treated as balanced. */
    public static final double MIN_RATE = 0.01;

    private final CalibrationVersion version;
    private final CalibrationParams params;

    public RatioPiecewiseCalibrator(CalibrationVersion version, CalibrationParams params) {
        this.version = version;
        this.params = params;
    }

    @Override
    public CalibrationVersion version() {
        return version;
    }

    @Override
    public LeadProbabilityResult calibrate(LeadProbabilityResult raw, RateEstimate rates) {
        double home = rates.rateHome();
        double away = rates.rateAway();
        if (home < MIN_RATE || away < MIN_RATE || home == away) {
            return raw;
        }
        double ratio = Math.max(home, away) / Math.min(home, away);
        double underdog = params.underdogMultiplier(ratio);
        double favourite = params.favoriteMultiplier(ratio);
        boolean homeIsUnderdog = home < away;

        double pHome = raw.pHomeLead() * (homeIsUnderdog ? underdog : favourite);
        double pAway = raw.pAwayLead() * (homeIsUnderdog ? favourite : underdog);
        log.debug("{}: ratio={} underdog x{} favourite x{}", params.version(), ratio, underdog, favourite);
        return raw.withLeads(
                OddsMath.clamp(pHome, PROBABILITY_EPSILON, 1.0 - PROBABILITY_EPSILON),
                OddsMath.clamp(pAway, PROBABILITY_EPSILON, 1.0 - PROBABILITY_EPSILON));
    }
}
