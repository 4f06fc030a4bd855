package com.zktune.tunebackend.ledger.dto;

import com.zktune.tunebackend.user.dto.CreatorDto;

public record CreatorSummaryDto(
        CreatorDto creator,
        long trackCount,
        long totalPlays,
        long totalPaidOut
) {}
