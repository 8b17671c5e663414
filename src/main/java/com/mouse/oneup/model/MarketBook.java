package com.mouse.oneup.model;

import com.mouse.oneup.enums.MarketFamily;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed quotes of one event snapshot, grouped by market family.
 */
public final class MarketBook {

    private final Map<MarketFamily, List<MarketQuote>> quotes;

    private MarketBook(Map<MarketFamily, List<MarketQuote>> quotes) {
        Map<MarketFamily, List<MarketQuote>> copy = new EnumMap<>(MarketFamily.class);
        quotes.forEach((family, list) -> copy.put(family, Collections.unmodifiableList(new ArrayList<>(list))));
        this.quotes = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static MarketBook empty() {
        return new MarketBook(Collections.emptyMap());
    }

    public List<MarketQuote> quotes(MarketFamily family) {
        return quotes.getOrDefault(family, Collections.emptyList());
    }

    public boolean has(MarketFamily family) {
        return !quotes(family).isEmpty();
    }

    /**
     * Quotes of the family that pass validation for its outcome count and line rule.
     */
    public List<MarketQuote> validQuotes(MarketFamily family) {
        List<MarketQuote> valid = new ArrayList<>();
        for (MarketQuote quote : quotes(family)) {
            if (quote != null && quote.isValid(family.getOutcomeCount(), family.isLined())) {
                valid.add(quote);
            }
        }
        return valid;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        quotes.forEach((family, list) -> list.forEach(q -> builder.add(family, q)));
        return builder;
    }

    public static final class Builder {
        private final Map<MarketFamily, List<MarketQuote>> quotes = new EnumMap<>(MarketFamily.class);

        public Builder add(MarketFamily family, MarketQuote quote) {
            quotes.computeIfAbsent(family, k -> new ArrayList<>()).add(quote);
            return this;
        }

        public Builder without(MarketFamily family) {
            quotes.remove(family);
            return this;
        }

        public MarketBook build() {
            return new MarketBook(quotes);
        }
    }
}
