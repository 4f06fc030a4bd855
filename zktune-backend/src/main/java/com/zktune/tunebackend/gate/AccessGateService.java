package com.zktune.tunebackend.gate;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.gate.dto.AccessGateInfo;
import com.zktune.tunebackend.gate.dto.AccessResult;
import com.zktune.tunebackend.gate.dto.WithdrawResult;
import com.zktune.tunebackend.payout.PaymentTransferService;
import com.zktune.tunebackend.payout.Payout;
import com.zktune.tunebackend.payout.PayoutRepository;
import com.zktune.tunebackend.payout.TransferReceipt;
import com.zktune.tunebackend.shared.Accounts;
import com.zktune.tunebackend.shared.LedgerError;
import com.zktune.tunebackend.shared.LedgerException;
import com.zktune.tunebackend.shared.LedgerTransactions;
import com.zktune.tunebackend.track.Track;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Operations on the access gate bound to a track. Callers pass a track loaded inside the ledger
 * write boundary; every method here runs in that boundary too.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccessGateService {

    private final AccessGateRepository gateRepository;
    private final AccessGrantRepository grantRepository;
    private final PayoutRepository payoutRepository;
    private final PaymentTransferService paymentTransferService;
    private final LedgerEventService events;
    private final LedgerTransactions tx;

    /**
     * Lets a consumer in. A consumer that already holds a grant gets in for free and nothing changes;
     * otherwise the payment must cover the unit price, and settlement credits escrow, counts the
     * grant and stores it together.
     */
    public AccessResult requestAccess(Track track, String consumerAccount, long payment) {
        String consumer = Accounts.require(consumerAccount, "Consumer");
        if (payment < 0) {
            throw new IllegalArgumentException("Payment cannot be negative");
        }

        return tx.write(() -> {
            AccessGate gate = track.getGate();
            if (grantRepository.existsByGateIdAndConsumerAccount(gate.getId(), consumer)) {
                return AccessResult.existingGrant();
            }

            long share = gate.settle(payment);
            grantRepository.save(new AccessGrant(gate, consumer, payment, share));
            gateRepository.save(gate);

            String owner = gate.getOwner().getAccount();
            events.emit(LedgerEventType.ROYALTY_ACCRUED, owner, consumer, track.getId(), share,
                    "escrow now " + gate.getEscrowBalance());
            events.emit(LedgerEventType.GRANT_ISSUED, consumer, owner, track.getId(), payment,
                    "grant #" + gate.getIssuedCount());
            return AccessResult.settled(share);
        });
    }

    /**
     * Pays the whole escrow of the track's gate out to its owner.
     * <p>
     * The balance is zeroed, and the payout row and {@code ROYALTY_PAID} event are flushed, before the
     * transfer is attempted; once money has moved only the commit is left to fail. If the transfer
     * fails or throws, the balance is put back and the call fails with
     * {@link LedgerError#TRANSFER_FAILED}, which rolls the pending payout back with it.
     *
     * @return the amount transferred
     */
    public WithdrawResult withdrawEscrow(Track track, String callerAccount) {
        String caller = Accounts.require(callerAccount, "Caller");

        return tx.write(() -> {
            AccessGate gate = track.getGate();
            if (!gate.isOwnedBy(caller)) {
                throw new LedgerException(LedgerError.NOT_OWNER,
                        caller + " does not own track " + track.getId());
            }

            long amount = gate.drainEscrow();
            gate.recordPayout(amount);
            gateRepository.save(gate);

            Payout payout = new Payout();
            payout.setCreatorAccount(caller);
            payout.setTrackId(track.getId());
            payout.setAmount(amount);
            payoutRepository.save(payout);
            events.emit(LedgerEventType.ROYALTY_PAID, caller, null, track.getId(), amount,
                    "escrow of track " + track.getId());
            payoutRepository.flush();

            TransferReceipt receipt;
            try {
                receipt = paymentTransferService.transfer(caller, amount);
            } catch (RuntimeException e) {
                gate.revertPayout(amount);
                log.warn("Transfer of {} to {} threw, escrow restored for track {}", amount, caller, track.getId(), e);
                throw new LedgerException(LedgerError.TRANSFER_FAILED, "Transfer failed: " + e.getMessage(), e);
            }
            if (receipt == null || !receipt.isSuccess()) {
                gate.revertPayout(amount);
                String why = receipt != null ? receipt.getMessage() : "no receipt";
                log.warn("Transfer of {} to {} failed ({}), escrow restored for track {}", amount, caller, why, track.getId());
                throw new LedgerException(LedgerError.TRANSFER_FAILED, "Transfer failed: " + why);
            }

            // managed row, written by the commit
            payout.setProvider(receipt.getProvider());
            payout.setReference(receipt.getReference());
            log.info("Paid {} to {} for track {} ({})", amount, caller, track.getId(), receipt.getReference());
            return new WithdrawResult(track.getId(), caller, amount, receipt.getReference());
        });
    }

    public boolean hasAccess(Track track, String consumerAccount) {
        if (consumerAccount == null || consumerAccount.isBlank()) return false;
        return grantRepository.existsByGateIdAndConsumerAccount(track.getGate().getId(), consumerAccount.strip());
    }

    public AccessGateInfo info(Track track) {
        AccessGate gate = track.getGate();
        return new AccessGateInfo(
                track.getId(),
                gate.getUnitPrice(),
                gate.getOwner().getId(),
                gate.getOwner().getAccount(),
                gate.getEscrowBalance(),
                gate.getRoyaltyBasisPoints(),
                gate.getIssuedCount(),
                grantRepository.findConsumerAccountsByGateId(gate.getId()),
                gate.getTotalAccrued(),
                gate.getTotalPaidOut()
        );
    }
}
