package com.mouse.oneup.model;

import java.math.BigDecimal;

/**
 * Decimal odds for one 1UP leg.
 */
public record PriceQuote(BigDecimal fairOdds, BigDecimal marginOdds, double marginFraction) {
}
