package com.zktune.tunebackend.event;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LedgerEventRepository extends JpaRepository<LedgerEvent, Long> {

    Page<LedgerEvent> findAllByOrderByIdAsc(Pageable pageable);

    Page<LedgerEvent> findByTrackIdOrderByIdAsc(Long trackId, Pageable pageable);

    List<LedgerEvent> findByTrackIdAndTypeOrderByIdAsc(Long trackId, LedgerEventType type);
}
