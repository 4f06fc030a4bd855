package com.zktune.tunebackend.ledger.dto;

import com.zktune.tunebackend.payout.dto.PayoutDto;

import java.util.List;

public record CreatorPayoutsDto(String account, long totalPaidOut, List<PayoutDto> payouts) {}
