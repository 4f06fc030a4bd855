package com.zktune.tunebackend.gate;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AccessGateRepository extends JpaRepository<AccessGate, Long> {
}
