package com.zktune.tunebackend.user;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "consumers")
public class Consumer {

    // storage key only; consumers are addressed by account everywhere else
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

    public Consumer(String account, String name, String profileRef) {
        this.account = account;
        this.name = name;
        this.profileRef = profileRef;
    }
}
