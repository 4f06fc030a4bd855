package com.zktune.tunebackend.event.dto;

import com.zktune.tunebackend.event.LedgerEvent;
import com.zktune.tunebackend.event.LedgerEventType;

import java.time.Instant;

public record LedgerEventDto(
        Long id,
        LedgerEventType type,
        String account,
        String counterparty,
        Long trackId,
        Long amount,
        String detail,
        Instant createdAt
) {
    public static LedgerEventDto from(LedgerEvent e) {
        return new LedgerEventDto(
                e.getId(),
                e.getType(),
                e.getAccount(),
                e.getCounterparty(),
                e.getTrackId(),
                e.getAmount(),
                e.getDetail(),
                e.getCreatedAt()
        );
    }
}
