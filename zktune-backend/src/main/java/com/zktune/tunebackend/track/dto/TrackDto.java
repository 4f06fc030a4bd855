package com.zktune.tunebackend.track.dto;

import java.time.Instant;

public record TrackDto(
        Long id,
        Long creatorId,
        String creatorAccount,
        String creatorName,
        String title,
        String audioRef,
        String coverRef,
        long playCount,
        long unitPrice,
        int royaltyBasisPoints,
        Instant publishedAt
) {}
