package com.mouse.oneup.service;

import com.mouse.oneup.enums.BookMaker;
import com.mouse.oneup.enums.MarketFamily;
import com.mouse.oneup.exception.PricingException;
import com.mouse.oneup.model.MarketBook;
import com.mouse.oneup.model.PricingRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
public class MarketBookValidator {

    /**
     * @throws PricingException when the request cannot be keyed
     */
    public void requireIdentity(PricingRequest request) {
        if (request == null) {
            throw new PricingException("Pricing request must not be null");
        }
        if (request.getEventId() == null || request.getEventId().isBlank()) {
            throw new PricingException("Pricing request has no event id");
        }
        if (request.getSourceIdentity() == null || request.getSourceIdentity().isBlank()) {
            throw new PricingException("Pricing request for event " + request.getEventId() + " has no source identity");
        }
        BookMaker.fromCode(request.getSourceIdentity()).ifPresentOrElse(
                bookMaker -> log.debug("Pricing {} snapshot | Event: {}", bookMaker.getDisplayName(), request.getEventId()),
                () -> log.debug("Unlisted source {} | Event: {}", request.getSourceIdentity(), request.getEventId()));
    }

    /**
     * Mandatory families without a single usable quote, in declaration order.
     */
    public List<MarketFamily> missingFamilies(MarketBook book) {
        List<MarketFamily> missing = new ArrayList<>();
        for (MarketFamily family : MarketFamily.mandatoryFamilies()) {
            if (book == null || book.validQuotes(family).isEmpty()) {
                missing.add(family);
            }
        }
        return missing;
    }
}
