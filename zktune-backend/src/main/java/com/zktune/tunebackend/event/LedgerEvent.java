package com.zktune.tunebackend.event;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Data
@Table(name = "ledger_events", indexes = @Index(name = "idx_ledger_events_track", columnList = "track_id"))
public class LedgerEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 32)
    @Enumerated(EnumType.STRING)
    private LedgerEventType type;

    // the identity the event is about: creator, consumer or payee
    @Column(nullable = false)
    private String account;

    // the other side, e.g. the consumer a grant was issued to
    private String counterparty;

    @Column(name = "track_id")
    private Long trackId;

    private Long amount;

    @Column(length = 512)
    private String detail;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt = Instant.now();
}
