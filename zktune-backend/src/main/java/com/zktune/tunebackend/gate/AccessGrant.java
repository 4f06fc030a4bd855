package com.zktune.tunebackend.gate;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * Permanent right of one consumer to play one track. Never revoked or deleted.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "access_grants",
        uniqueConstraints = @UniqueConstraint(name = "uk_grant_gate_consumer",
                columnNames = {"gate_id", "consumer_account"}))
public class AccessGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "gate_id")
    private AccessGate gate;

    @Column(name = "consumer_account", nullable = false)
    private String consumerAccount;

    @Column(name = "price_paid", nullable = false)
    private long pricePaid;

    @Column(name = "royalty_share", nullable = false)
    private long royaltyShare;

    @CreationTimestamp
    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    public AccessGrant(AccessGate gate, String consumerAccount, long pricePaid, long royaltyShare) {
        this.gate = gate;
        this.consumerAccount = consumerAccount;
        this.pricePaid = pricePaid;
        this.royaltyShare = royaltyShare;
    }
}
