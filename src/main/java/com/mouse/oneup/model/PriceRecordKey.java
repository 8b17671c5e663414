package com.mouse.oneup.model;

public record PriceRecordKey(String eventId, String snapshotId, String engineVersion, String sourceIdentity) {
}
