package com.zktune.tunebackend.track;

import com.zktune.tunebackend.gate.AccessGate;
import com.zktune.tunebackend.user.Creator;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A published work. Everything except the play count is fixed at publish time.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "tracks", indexes = @Index(name = "idx_tracks_creator", columnList = "creator_id"))
public class Track {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "creator_id")
    private Creator creator;

    @Column(nullable = false)
    private String title;

    // opaque references resolved by the media host
    @Column(name = "audio_ref", nullable = false, length = 1024)
    private String audioRef;

    @Column(name = "cover_ref", nullable = false, length = 1024)
    private String coverRef;

    @Column(name = "play_count", nullable = false)
    private long playCount = 0;

    @OneToOne(cascade = CascadeType.ALL, optional = false, orphanRemoval = true)
    @JoinColumn(name = "gate_id", nullable = false, unique = true)
    private AccessGate gate;

    @CreationTimestamp
    @Column(name = "published_at", nullable = false, updatable = false)
    private Instant publishedAt;

    public void incrementPlayCount() {
        playCount++;
    }
}
