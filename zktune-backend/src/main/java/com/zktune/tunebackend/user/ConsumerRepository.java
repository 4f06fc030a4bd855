package com.zktune.tunebackend.user;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ConsumerRepository extends JpaRepository<Consumer, Long> {

    Optional<Consumer> findByAccount(String account);

    boolean existsByAccount(String account);
}
