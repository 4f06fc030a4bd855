package com.zktune.tunebackend.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PayoutRepository extends JpaRepository<Payout, Long> {

    List<Payout> findByCreatorAccountOrderByIdAsc(String creatorAccount);

    @Query("SELECT COALESCE(SUM(p.amount), 0) FROM Payout p WHERE p.creatorAccount = :account")
    long sumAmountByCreatorAccount(@Param("account") String account);
}
