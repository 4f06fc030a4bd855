package com.zktune.tunebackend.payout;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Local-only simulated transfer provider. Real payment rails plug in by providing another
 * {@link PaymentTransferService} bean.
 */
@Slf4j
@Service
public class LocalPaymentTransferService implements PaymentTransferService {

    private final String provider;
    private final boolean simulateFailure;

    public LocalPaymentTransferService(
            @Value("${app.payments.provider:test}") String provider,
            @Value("${app.payments.simulate-failure:false}") boolean simulateFailure
    ) {
        this.provider = provider;
        this.simulateFailure = simulateFailure;
    }

    @Override
    public TransferReceipt transfer(String toAccount, long amount) {
        if (!"test".equalsIgnoreCase(provider)) {
            return TransferReceipt.failed(provider, "Only local test transfers are supported by this provider");
        }
        if (simulateFailure) {
            log.warn("Simulated transfer failure: {} to {}", amount, toAccount);
            return TransferReceipt.failed(provider, "Simulated transfer failure");
        }

        String reference = "local_" + UUID.randomUUID();
        log.info("Transferred {} to {} ({})", amount, toAccount, reference);
        return TransferReceipt.builder()
                .success(true)
                .provider(provider)
                .reference(reference)
                .message("Transfer completed")
                .build();
    }
}
