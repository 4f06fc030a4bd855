package com.zktune.tunebackend.gate.dto;

public record WithdrawResult(Long trackId, String payee, long amount, String reference) {}
