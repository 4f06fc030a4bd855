package com.zktune.tunebackend.payout;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferReceipt {
    private boolean success;
    private String provider;     // "test" for the local simulation
    private String reference;    // provider's transfer id, null on failure
    private String message;

    public static TransferReceipt failed(String provider, String message) {
        return TransferReceipt.builder()
                .success(false)
                .provider(provider)
                .message(message)
                .build();
    }
}
