package com.mouse.oneup.model;

import lombok.Builder;
import lombok.Value;

/**
 * One pricing call: the markets of an (event, snapshot, source) triple.
 */
@Value
@Builder(toBuilder = true)
public class PricingRequest {
    String eventId;
    String snapshotId;
    String sourceIdentity;
    MarketBook markets;

    /** Overrides the configured margin for both sides when set. */
    Double marginFraction;
}
