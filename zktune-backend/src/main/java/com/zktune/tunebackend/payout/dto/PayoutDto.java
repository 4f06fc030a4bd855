package com.zktune.tunebackend.payout.dto;

import com.zktune.tunebackend.payout.Payout;

import java.time.Instant;

public record PayoutDto(Long id, Long trackId, long amount, String provider, String reference, Instant paidAt) {

    public static PayoutDto from(Payout p) {
        return new PayoutDto(p.getId(), p.getTrackId(), p.getAmount(), p.getProvider(), p.getReference(), p.getPaidAt());
    }
}
