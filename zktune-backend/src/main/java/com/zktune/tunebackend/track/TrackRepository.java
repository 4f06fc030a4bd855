package com.zktune.tunebackend.track;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface TrackRepository extends JpaRepository<Track, Long> {

    // ids are handed out in publish order, so id order is insertion order
    List<Track> findAllByOrderByIdAsc();

    List<Track> findByCreatorAccountOrderByIdAsc(String account);

    long countByCreatorAccount(String account);

    @Query("SELECT COALESCE(SUM(t.playCount), 0) FROM Track t WHERE t.creator.account = :account")
    long sumPlayCountByCreatorAccount(@Param("account") String account);
}
