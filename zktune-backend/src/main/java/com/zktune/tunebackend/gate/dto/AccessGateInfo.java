package com.zktune.tunebackend.gate.dto;

import java.util.List;

public record AccessGateInfo(
        Long trackId,
        long unitPrice,
        Long ownerCreatorId,
        String ownerAccount,
        long escrowBalance,
        int royaltyBasisPoints,
        long issuedCount,
        List<String> grantedTo,
        long totalAccrued,
        long totalPaidOut
) {}
