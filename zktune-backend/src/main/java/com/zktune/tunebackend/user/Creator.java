package com.zktune.tunebackend.user;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

/**
 * A registered creator. The id comes from the table's identity sequence: it starts at 1 and is
 * never handed out twice.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "creators")
public class Creator {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String account;

    @Column(nullable = false)
    private String name;

    @Column(name = "profile_ref", nullable = false, length = 1024)
    private String profileRef;

    @CreationTimestamp
    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    public Creator(String account, String name, String profileRef) {
        this.account = account;
        this.name = name;
        this.profileRef = profileRef;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Creator other = (Creator) o;
        return id != null && id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return 31;
    }
}
