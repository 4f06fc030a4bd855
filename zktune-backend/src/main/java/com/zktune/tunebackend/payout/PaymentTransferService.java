package com.zktune.tunebackend.payout;

/**
 * Moves money out of the ledger to a payee. Implementations may fail, either by returning an
 * unsuccessful receipt or by throwing; the ledger never retries a transfer.
 */
public interface PaymentTransferService {
    TransferReceipt transfer(String toAccount, long amount);
}
