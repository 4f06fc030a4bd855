package com.zktune.tunebackend.gate;

import com.zktune.tunebackend.shared.LedgerError;
import com.zktune.tunebackend.shared.LedgerException;
import com.zktune.tunebackend.user.Creator;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Pay-once access control and royalty escrow for a single track. Created together with its track
 * and never removed while the track exists.
 * <p>
 * Amounts are in the smallest currency unit. Only the royalty share of a payment is kept here; the
 * rest of the payment is not tracked by the ledger.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "access_gates")
public class AccessGate {

    public static final int BASIS_POINTS_SCALE = 10_000;
    public static final int DEFAULT_ROYALTY_BASIS_POINTS = 3_000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "unit_price", nullable = false)
    private long unitPrice;

    @ManyToOne(optional = false)
    @JoinColumn(name = "owner_id")
    private Creator owner;

    @Column(name = "escrow_balance", nullable = false)
    private long escrowBalance = 0;

    @Column(name = "royalty_basis_points", nullable = false)
    private int royaltyBasisPoints = DEFAULT_ROYALTY_BASIS_POINTS;

    @Column(name = "issued_count", nullable = false)
    private long issuedCount = 0;

    @Column(name = "total_accrued", nullable = false)
    private long totalAccrued = 0;

    @Column(name = "total_paid_out", nullable = false)
    private long totalPaidOut = 0;

    public AccessGate(Creator owner, long unitPrice, int royaltyBasisPoints) {
        if (unitPrice < 0) {
            throw new IllegalArgumentException("Unit price cannot be negative");
        }
        if (royaltyBasisPoints < 0 || royaltyBasisPoints > BASIS_POINTS_SCALE) {
            throw new IllegalArgumentException("Royalty basis points must be between 0 and " + BASIS_POINTS_SCALE);
        }
        this.owner = owner;
        this.unitPrice = unitPrice;
        this.royaltyBasisPoints = royaltyBasisPoints;
    }

    /**
     * floor(payment * basisPoints / 10000), split on the scale so the product never leaves the
     * {@code long} range for any non-negative payment.
     */
    public static long royaltyShare(long payment, int basisPoints) {
        long whole = payment / BASIS_POINTS_SCALE;
        long rest = payment % BASIS_POINTS_SCALE;
        return whole * basisPoints + rest * basisPoints / BASIS_POINTS_SCALE;
    }

    /**
     * Takes a first-time payment: credits the royalty share to escrow and counts one more grant.
     * Nothing changes when the payment is short.
     *
     * @return the royalty share credited
     */
    public long settle(long payment) {
        if (payment < unitPrice) {
            throw new LedgerException(LedgerError.INSUFFICIENT_PAYMENT,
                    "Payment of " + payment + " is below the unit price of " + unitPrice);
        }
        long share = royaltyShare(payment, royaltyBasisPoints);
        escrowBalance = Math.addExact(escrowBalance, share);
        totalAccrued = Math.addExact(totalAccrued, share);
        issuedCount++;
        return share;
    }

    public boolean isOwnedBy(String account) {
        return owner != null && owner.getAccount().equals(account);
    }

    /** Empties the escrow and returns what it held. */
    public long drainEscrow() {
        if (escrowBalance <= 0) {
            throw new LedgerException(LedgerError.NOTHING_TO_WITHDRAW, "Escrow is empty");
        }
        long amount = escrowBalance;
        escrowBalance = 0;
        return amount;
    }

    /** Puts back an amount taken by {@link #drainEscrow()} whose transfer did not go through. */
    public void restoreEscrow(long amount) {
        escrowBalance = Math.addExact(escrowBalance, amount);
    }

    public void recordPayout(long amount) {
        totalPaidOut = Math.addExact(totalPaidOut, amount);
    }

    /** Undoes {@link #recordPayout(long)} and {@link #drainEscrow()} for a transfer that did not go through. */
    public void revertPayout(long amount) {
        totalPaidOut = Math.subtractExact(totalPaidOut, amount);
        restoreEscrow(amount);
    }
}
