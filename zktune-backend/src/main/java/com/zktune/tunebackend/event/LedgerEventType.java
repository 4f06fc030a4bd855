package com.zktune.tunebackend.event;

public enum LedgerEventType {
    CREATOR_REGISTERED,
    CONSUMER_REGISTERED,
    TRACK_PUBLISHED,
    ROYALTY_ACCRUED,
    GRANT_ISSUED,
    ROYALTY_PAID,
    PLAYED
}
