package com.zktune.tunebackend.ledger;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * One play of a track by a consumer. Append-only; the id doubles as the play sequence number.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "play_records", indexes = @Index(name = "idx_play_records_consumer", columnList = "consumer_account"))
public class PlayRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "track_id", nullable = false)
    private Long trackId;

    @Column(name = "consumer_account", nullable = false)
    private String consumerAccount;

    // true when this play paid for the grant
    @Column(nullable = false)
    private boolean settled;

    @CreationTimestamp
    @Column(name = "played_at", nullable = false, updatable = false)
    private Instant playedAt;

    public PlayRecord(Long trackId, String consumerAccount, boolean settled) {
        this.trackId = trackId;
        this.consumerAccount = consumerAccount;
        this.settled = settled;
    }
}
