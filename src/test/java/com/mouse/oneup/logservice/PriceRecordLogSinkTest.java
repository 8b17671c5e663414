package com.mouse.oneup.logservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.enums.PricingStatus;
import com.mouse.oneup.model.LeadPriceRecord;
import com.mouse.oneup.model.MarketBook;
import com.mouse.oneup.model.PriceQuote;
import com.mouse.oneup.model.PriceRecordKey;
import com.mouse.oneup.model.PricingRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PriceRecordLogSinkTest {

    private static final String VERSION = "oneup/exact-dp/ratio-piecewise-v2";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PriceRecordLogSink sink;

    @BeforeEach
    void setUp() {
        sink = new PriceRecordLogSink(objectMapper);
    }

    private static LeadPriceRecord pricedRecord() {
        return LeadPriceRecord.builder()
                .status(PricingStatus.PRICED)
                .eventId("EVT-1")
                .snapshotId("SNAP-1")
                .sourceIdentity("sporty")
                .engineVersion(VERSION)
                .rateHome(1.5)
                .rateAway(1.0)
                .rateTotal(2.5)
                .pHomeLead(0.55)
                .pAwayLead(0.40)
                .pLevelFullTime(0.27)
                .home(new PriceQuote(new BigDecimal("1.82"), new BigDecimal("1.73"), 0.05))
                .away(new PriceQuote(new BigDecimal("2.50"), new BigDecimal("2.38"), 0.05))
                .drawOdds(new BigDecimal("3.60"))
                .build();
    }

    @Test
    @DisplayName("write_remembersKey")
    void write_remembersKey() {
        PriceRecordKey key = new PriceRecordKey("EVT-1", "SNAP-1", VERSION, "sporty");
        assertThat(sink.exists(key)).isFalse();

        sink.write(pricedRecord());

        assertThat(sink.exists(key)).isTrue();
        assertThat(sink.exists(new PriceRecordKey("EVT-1", "SNAP-1", VERSION, "bet9ja"))).isFalse();
        assertThat(sink.writtenCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("write_sameKeyTwice_countedOnce")
    void write_sameKeyTwice_countedOnce() {
        sink.write(pricedRecord());
        sink.write(pricedRecord());

        assertThat(sink.writtenCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("serialisedRecord_keepsLeadFieldNames")
    void serialisedRecord_keepsLeadFieldNames() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(pricedRecord()));

        assertThat(json.get("pHomeLead").asDouble()).isEqualTo(0.55);
        assertThat(json.get("pAwayLead").asDouble()).isEqualTo(0.40);
        assertThat(json.get("pLevelFullTime").asDouble()).isEqualTo(0.27);
        assertThat(json.has("phomeLead")).isFalse();
        assertThat(json.has("pawayLead")).isFalse();
        assertThat(json.has("plevelFullTime")).isFalse();
        assertThat(json.get("home").get("fairOdds").decimalValue()).isEqualByComparingTo("1.82");
        assertThat(json.has("key")).isFalse();
        assertThat(json.has("priced")).isFalse();
    }

    @Test
    @DisplayName("write_insufficientDataSentinel_listsMissingFamilies")
    void write_insufficientDataSentinel_listsMissingFamilies() throws Exception {
        PricingRequest request = PricingRequest.builder()
                .eventId("EVT-2")
                .snapshotId("SNAP-1")
                .sourceIdentity("pawa")
                .markets(MarketBook.empty())
                .build();
        LeadPriceRecord sentinel = LeadPriceRecord.insufficientData(request, VERSION,
                List.of(MarketFamily.TOTAL_GOALS, MarketFamily.MATCH_RESULT));

        sink.write(sentinel);

        assertThat(sink.exists(sentinel.getKey())).isTrue();
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(sentinel));
        assertThat(json.get("status").asText()).isEqualTo("INSUFFICIENT_DATA");
        assertThat(json.get("missingFamilies")).hasSize(2);
    }
}
