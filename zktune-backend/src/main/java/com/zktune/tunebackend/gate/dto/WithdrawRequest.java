package com.zktune.tunebackend.gate.dto;

import jakarta.validation.constraints.NotBlank;

public record WithdrawRequest(@NotBlank String caller) {}
