package com.mouse.oneup.interfaces;

import com.mouse.oneup.model.LeadPriceRecord;
import com.mouse.oneup.model.PriceRecordKey;

/**
 * Destination of priced records. Calls to {@link #write} come from a single thread.
 */
public interface PriceRecordSink {

    boolean exists(PriceRecordKey key);

    void write(LeadPriceRecord record);
}
