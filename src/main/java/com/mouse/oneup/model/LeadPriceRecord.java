package com.mouse.oneup.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.PricingStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Priced 1UP legs of one (event, snapshot, source), or the INSUFFICIENT_DATA sentinel
 * naming the market families that were missing.
 */
@Value
@Builder(toBuilder = true)
public class LeadPriceRecord {

    PricingStatus status;

    String eventId;
    String snapshotId;
    String sourceIdentity;
    String engineVersion;

    Double rateHome;
    Double rateAway;
    Double rateTotal;

    @Getter(onMethod_ = @JsonProperty("pHomeLead"))
    Double pHomeLead;
    @Getter(onMethod_ = @JsonProperty("pAwayLead"))
    Double pAwayLead;
    @Getter(onMethod_ = @JsonProperty("pLevelFullTime"))
    Double pLevelFullTime;

    PriceQuote home;
    PriceQuote away;
    BigDecimal drawOdds;

    List<MarketFamily> missingFamilies;

    PricingDiagnostics diagnostics;

    public static LeadPriceRecord insufficientData(PricingRequest request, String engineVersion,
                                                   List<MarketFamily> missingFamilies) {
        return LeadPriceRecord.builder()
                .status(PricingStatus.INSUFFICIENT_DATA)
                .eventId(request.getEventId())
                .snapshotId(request.getSnapshotId())
                .sourceIdentity(request.getSourceIdentity())
                .engineVersion(engineVersion)
                .missingFamilies(List.copyOf(missingFamilies))
                .build();
    }

    @JsonIgnore
    public PriceRecordKey getKey() {
        return new PriceRecordKey(eventId, snapshotId, engineVersion, sourceIdentity);
    }

    @JsonIgnore
    public boolean isPriced() {
        return status == PricingStatus.PRICED;
    }
}
