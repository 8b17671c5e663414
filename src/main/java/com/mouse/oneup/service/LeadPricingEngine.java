package com.mouse.oneup.service;

import com.mouse.oneup.config.PricingSettings;
import com.mouse.oneup.enums.FitMethod;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.PricingStatus;
import com.mouse.oneup.enums.ShareSource;
import com.mouse.oneup.interfaces.LeadProbabilityEngine;
import com.mouse.oneup.interfaces.ProbabilityCalibrator;
import com.mouse.oneup.model.ConditionalShare;
import com.mouse.oneup.model.LeadPriceRecord;
import com.mouse.oneup.model.LeadProbabilityResult;
import com.mouse.oneup.model.MarketBook;
import com.mouse.oneup.model.MarketQuote;
import com.mouse.oneup.model.MatchOutcomeProbabilities;
import com.mouse.oneup.model.PriceQuote;
import com.mouse.oneup.model.PricingDiagnostics;
import com.mouse.oneup.model.PricingRequest;
import com.mouse.oneup.model.RateEstimate;
import com.mouse.oneup.model.RateFit;
import com.mouse.oneup.model.SplitDecision;
import com.mouse.oneup.model.SupremacyFit;
import com.mouse.oneup.utils.OddsMath;
import com.mouse.oneup.utils.PoissonMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Prices the 1UP legs of one (event, snapshot, source): rates from the goals markets,
 * split fitted to 1X2 or taken from the first-scorer market, lead probabilities from the
 * configured strategy, calibration, then odds.
 *
 * <p>Stateless; safe to call from many threads.
 */
@Slf4j
@Service
public class LeadPricingEngine {

    private static final double LEAD_EPSILON = 1e-9;

    private static final String EMOJI_SUCCESS = "✅";
    private static final String EMOJI_WARNING = "⚠️";
    private static final String EMOJI_TARGET = "🎯";

    private final PricingSettings settings;
    private final MarketBookValidator validator;
    private final RateInferenceService rateInference;
    private final SplitEstimator splitEstimator;
    private final SupremacyCalibrator supremacyCalibrator;
    private final LeadProbabilityEngine leadEngine;
    private final ProbabilityCalibrator calibrator;
    private final PriceComposer priceComposer;
    private final EngineMetricsService metrics;
    private final String engineVersion;

    public LeadPricingEngine(PricingSettings settings,
                             MarketBookValidator validator,
                             RateInferenceService rateInference,
                             SplitEstimator splitEstimator,
                             SupremacyCalibrator supremacyCalibrator,
                             LeadProbabilityEngine leadEngine,
                             ProbabilityCalibrator calibrator,
                             PriceComposer priceComposer,
                             EngineMetricsService metrics) {
        this.settings = settings;
        this.validator = validator;
        this.rateInference = rateInference;
        this.splitEstimator = splitEstimator;
        this.supremacyCalibrator = supremacyCalibrator;
        this.leadEngine = leadEngine;
        this.calibrator = calibrator;
        this.priceComposer = priceComposer;
        this.metrics = metrics;
        this.engineVersion = PricingSettings.engineVersion(
                settings.getEngineName(), leadEngine.type(), calibrator.version());
    }

    public String getEngineVersion() {
        return engineVersion;
    }

    /**
     * @return a PRICED record, or the INSUFFICIENT_DATA sentinel when a mandatory market is missing
     * @throws com.mouse.oneup.exception.PricingException when the request cannot be keyed or an internal invariant breaks
     */
    public LeadPriceRecord price(PricingRequest request) {
        validator.requireIdentity(request);
        MarketBook book = request.getMarkets() != null ? request.getMarkets() : MarketBook.empty();

        List<MarketFamily> missing = validator.missingFamilies(book);
        if (!missing.isEmpty()) {
            log.warn("{} Insufficient data | Event: {} | Source: {} | Missing: {}",
                    EMOJI_WARNING, request.getEventId(), request.getSourceIdentity(), missing);
            metrics.recordInsufficientData();
            return LeadPriceRecord.insufficientData(request, engineVersion, missing);
        }

        List<String> notes = new ArrayList<>();
        PricingDiagnostics.PricingDiagnosticsBuilder diagnostics = PricingDiagnostics.builder()
                .calibrationVersion(calibrator.version().getLabel());

        RateFit total = fitFamily(MarketFamily.TOTAL_GOALS, book, diagnostics, notes);
        RateFit home = fitFamily(MarketFamily.HOME_GOALS, book, diagnostics, notes);
        RateFit away = fitFamily(MarketFamily.AWAY_GOALS, book, diagnostics, notes);

        MarketQuote matchResult = book.validQuotes(MarketFamily.MATCH_RESULT).get(0);
        double[] outcome = OddsMath.devig(matchResult.odds(0), matchResult.odds(1), matchResult.odds(2));
        MatchOutcomeProbabilities market = new MatchOutcomeProbabilities(outcome[0], outcome[1], outcome[2]);

        RateEstimate proportional = splitEstimator.proportional(total.rate(), home.rate(), away.rate());
        SupremacyFit supremacy = supremacyCalibrator.fit(total.rate(), market, proportional);
        ShareSource fittedSource = supremacy.method() == FitMethod.BOUNDED || supremacy.method() == FitMethod.GRID
                ? ShareSource.SUPREMACY_FIT
                : ShareSource.PROPORTIONAL;

        Optional<ConditionalShare> firstScorer = splitEstimator.firstScorerShare(request);
        SplitDecision split = splitEstimator.decide(supremacy.rates(), fittedSource, firstScorer, notes);
        RateEstimate rates = split.rates();

        LeadProbabilityResult raw = leadEngine.estimate(rates, split.hasShareOverride() ? split.homeShare() : null);
        raw = guardLeads(raw, notes);
        LeadProbabilityResult calibrated = calibrator.calibrate(raw, rates);

        PriceQuote homeQuote = priceComposer.quote(calibrated.pHomeLead(), priceComposer.homeMargin(request));
        PriceQuote awayQuote = priceComposer.quote(calibrated.pAwayLead(), priceComposer.awayMargin(request));
        BigDecimal drawOdds = priceComposer.scale(matchResult.odds(1));

        diagnostics
                .rawHomeLead(raw.pHomeLead())
                .rawAwayLead(raw.pAwayLead())
                .homeShare(split.homeShare())
                .shareSource(split.source())
                .shareProvider(firstScorer.map(ConditionalShare::provider).orElse(null))
                .supremacy(Double.isNaN(supremacy.supremacy()) ? null : supremacy.supremacy())
                .supremacyMethod(supremacy.method())
                .supremacyLoss(Double.isNaN(supremacy.loss()) ? null : supremacy.loss())
                .proportionalRateHome(proportional.rateHome())
                .proportionalRateAway(proportional.rateAway())
                .marketOutcome(market)
                .modelOutcome(PoissonMath.matchOutcome(rates.rateHome(), rates.rateAway(), settings.getSupremacyGoalGrid()));
        crossCheckBothTeamsScore(book, rates, diagnostics);
        firstScorer.ifPresent(share -> diagnostics
                .noGoalMarket(share.pNoGoal())
                .noGoalModel(PoissonMath.noGoal(rates.rateTotal())));
        PricingDiagnostics audit = diagnostics.degenerateNotes(notes).build();

        if (audit.isDegenerate()) {
            metrics.recordDegenerate();
            log.warn("{} Degenerate inputs | Event: {} | Source: {} | {}",
                    EMOJI_WARNING, request.getEventId(), request.getSourceIdentity(), notes);
        }
        metrics.recordPriced(leadEngine.type());

        LeadPriceRecord record = LeadPriceRecord.builder()
                .status(PricingStatus.PRICED)
                .eventId(request.getEventId())
                .snapshotId(request.getSnapshotId())
                .sourceIdentity(request.getSourceIdentity())
                .engineVersion(engineVersion)
                .rateHome(rates.rateHome())
                .rateAway(rates.rateAway())
                .rateTotal(rates.rateTotal())
                .pHomeLead(calibrated.pHomeLead())
                .pAwayLead(calibrated.pAwayLead())
                .pLevelFullTime(calibrated.pLevelFullTime())
                .home(homeQuote)
                .away(awayQuote)
                .drawOdds(drawOdds)
                .missingFamilies(List.of())
                .diagnostics(audit)
                .build();

        log.debug("{} {} Priced | Event: {} | Source: {} | Home: {} ({}) | Away: {} ({}) | Share: {} via {}",
                EMOJI_SUCCESS, EMOJI_TARGET, request.getEventId(), request.getSourceIdentity(),
                homeQuote.fairOdds(), homeQuote.marginOdds(), awayQuote.fairOdds(), awayQuote.marginOdds(),
                split.homeShare(), split.source());
        return record;
    }

    private RateFit fitFamily(MarketFamily family, MarketBook book,
                              PricingDiagnostics.PricingDiagnosticsBuilder diagnostics, List<String> notes) {
        RateFit fit = rateInference.inferRate(family, book.quotes(family));
        diagnostics.fitMethod(family, fit.method());
        diagnostics.rejectedLine(family, fit.linesRejected());
        if (fit.method() == FitMethod.FALLBACK_CONSTANT) {
            notes.add(family + " rate fell back to " + fit.rate());
        }
        return fit;
    }

    private LeadProbabilityResult guardLeads(LeadProbabilityResult raw, List<String> notes) {
        double home = OddsMath.clamp(raw.pHomeLead(), LEAD_EPSILON, 1.0 - LEAD_EPSILON);
        double away = OddsMath.clamp(raw.pAwayLead(), LEAD_EPSILON, 1.0 - LEAD_EPSILON);
        double level = OddsMath.clamp(raw.pLevelFullTime(), LEAD_EPSILON, 1.0 - LEAD_EPSILON);
        if (home != raw.pHomeLead() || away != raw.pAwayLead()) {
            notes.add("raw lead probabilities (" + raw.pHomeLead() + ", " + raw.pAwayLead() + ") clamped");
        }
        if (level != raw.pLevelFullTime()) {
            notes.add("level full-time probability " + raw.pLevelFullTime() + " clamped");
        }
        if (home != raw.pHomeLead() || away != raw.pAwayLead() || level != raw.pLevelFullTime()) {
            return new LeadProbabilityResult(home, away, level);
        }
        return raw;
    }

    private void crossCheckBothTeamsScore(MarketBook book, RateEstimate rates,
                                          PricingDiagnostics.PricingDiagnosticsBuilder diagnostics) {
        List<MarketQuote> btts = book.validQuotes(MarketFamily.BOTH_TEAMS_TO_SCORE);
        if (btts.isEmpty()) {
            return;
        }
        MarketQuote quote = btts.get(0);
        diagnostics
                .bttsMarket(OddsMath.devigTwoWay(quote.odds(0), quote.odds(1)))
                .bttsModel(PoissonMath.bothTeamsScore(rates.rateHome(), rates.rateAway()));
    }
}
