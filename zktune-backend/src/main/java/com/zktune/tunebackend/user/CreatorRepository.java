package com.zktune.tunebackend.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CreatorRepository extends JpaRepository<Creator, Long> {

    Optional<Creator> findByAccount(String account);

    boolean existsByAccount(String account);
}
