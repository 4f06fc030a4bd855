package com.zktune.tunebackend.gate;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface AccessGrantRepository extends JpaRepository<AccessGrant, Long> {

    boolean existsByGateIdAndConsumerAccount(Long gateId, String consumerAccount);

    @Query("SELECT g.consumerAccount FROM AccessGrant g WHERE g.gate.id = :gateId ORDER BY g.id")
    List<String> findConsumerAccountsByGateId(@Param("gateId") Long gateId);
}
