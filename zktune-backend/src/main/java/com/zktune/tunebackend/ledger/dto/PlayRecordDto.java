package com.zktune.tunebackend.ledger.dto;

import com.zktune.tunebackend.ledger.PlayRecord;

import java.time.Instant;

public record PlayRecordDto(Long sequence, Long trackId, boolean settled, Instant playedAt) {

    public static PlayRecordDto from(PlayRecord r) {
        return new PlayRecordDto(r.getId(), r.getTrackId(), r.isSettled(), r.getPlayedAt());
    }
}
