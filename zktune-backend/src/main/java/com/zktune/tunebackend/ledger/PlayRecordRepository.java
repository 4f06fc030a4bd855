package com.zktune.tunebackend.ledger;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlayRecordRepository extends JpaRepository<PlayRecord, Long> {

    List<PlayRecord> findByConsumerAccountOrderByIdAsc(String consumerAccount);
}
