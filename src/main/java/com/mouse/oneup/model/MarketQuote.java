package com.mouse.oneup.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One parsed market price: an optional line plus 2 or 3 decimal odds, optionally tagged
 * with the provider that quoted it.
 *
 * @param line        goals line for O/U families, null otherwise
 * @param outcomeOdds decimal odds in the family's outcome order (over/under, home/draw/away, ...)
 * @param provider    source code of the quoting provider; null means the request's own source
 */
public record MarketQuote(Double line, List<Double> outcomeOdds, String provider) {

    public MarketQuote {
        outcomeOdds = outcomeOdds == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(outcomeOdds));
    }

    public static MarketQuote overUnder(double line, Double over, Double under) {
        return new MarketQuote(line, oddsOf(over, under), null);
    }

    public static MarketQuote twoWay(Double yes, Double no) {
        return new MarketQuote(null, oddsOf(yes, no), null);
    }

    public static MarketQuote threeWay(Double first, Double second, Double third) {
        return new MarketQuote(null, oddsOf(first, second, third), null);
    }

    public MarketQuote fromProvider(String providerCode) {
        return new MarketQuote(line, outcomeOdds, providerCode);
    }

    public double odds(int index) {
        return outcomeOdds.get(index);
    }

    /**
     * A quote is usable when it has the expected number of outcomes, every price is a
     * finite decimal above 1.0 and, for lined families, the line is present.
     */
    public boolean isValid(int expectedOutcomes, boolean requiresLine) {
        if (requiresLine && (line == null || !Double.isFinite(line))) {
            return false;
        }
        if (outcomeOdds.size() != expectedOutcomes) {
            return false;
        }
        for (Double odd : outcomeOdds) {
            if (odd == null || !Double.isFinite(odd) || odd <= 1.0) {
                return false;
            }
        }
        return true;
    }

    private static List<Double> oddsOf(Double... odds) {
        List<Double> list = new ArrayList<>(odds.length);
        Collections.addAll(list, odds);
        return list;
    }
}
