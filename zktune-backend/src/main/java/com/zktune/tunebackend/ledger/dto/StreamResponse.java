package com.zktune.tunebackend.ledger.dto;

public record StreamResponse(
        Long trackId,
        String audioRef,
        boolean settled,
        long royaltyShare,
        long playCount,
        Long playId
) {}
