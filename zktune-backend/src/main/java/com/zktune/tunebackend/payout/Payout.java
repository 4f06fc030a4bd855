package com.zktune.tunebackend.payout;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Data
@NoArgsConstructor
@Table(name = "payouts")
public class Payout {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "creator_account", nullable = false)
    private String creatorAccount;

    @Column(name = "track_id", nullable = false)
    private Long trackId;

    @Column(nullable = false)
    private long amount;

    @Column(length = 32)
    private String provider;

    @Column(length = 128)
    private String reference;

    @Column(name = "paid_at", nullable = false)
    private Instant paidAt;

    @PrePersist
    void prePersist() {
        if (paidAt == null) paidAt = Instant.now();
    }
}
