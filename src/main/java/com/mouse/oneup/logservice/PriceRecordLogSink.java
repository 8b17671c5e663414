package com.mouse.oneup.logservice;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mouse.oneup.exception.PricingException;
import com.mouse.oneup.interfaces.PriceRecordSink;
import com.mouse.oneup.model.LeadPriceRecord;
import com.mouse.oneup.model.PriceRecordKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Writes each record as one JSON line to the application log and remembers its key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceRecordLogSink implements PriceRecordSink {

    private final ObjectMapper objectMapper;
    private final Set<PriceRecordKey> written = ConcurrentHashMap.newKeySet();

    @Override
    public boolean exists(PriceRecordKey key) {
        return written.contains(key);
    }

    @Override
    public void write(LeadPriceRecord record) {
        try {
            log.info("1UP RECORD | {}", objectMapper.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new PricingException("Failed to serialise record for event " + record.getEventId(), e);
        }
        written.add(record.getKey());
    }

    public int writtenCount() {
        return written.size();
    }
}
