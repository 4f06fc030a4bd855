package com.zktune.tunebackend.ledger.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamRequest {

    @NotBlank
    private String consumer;

    // may be 0 when the consumer already holds a grant
    @Min(0)
    private long payment;
}
