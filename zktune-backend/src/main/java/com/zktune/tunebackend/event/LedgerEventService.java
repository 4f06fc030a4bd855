package com.zktune.tunebackend.event;

import com.zktune.tunebackend.event.dto.LedgerEventDto;
import com.zktune.tunebackend.shared.PageResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Audit trail of everything the ledger does. Events are written in the caller's transaction, so an
 * operation that fails leaves no event behind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerEventService {

    private final LedgerEventRepository repository;

    public LedgerEvent emit(LedgerEventType type, String account, String counterparty,
                            Long trackId, Long amount, String detail) {
        LedgerEvent e = new LedgerEvent();
        e.setType(type);
        e.setAccount(account);
        e.setCounterparty(counterparty);
        e.setTrackId(trackId);
        e.setAmount(amount);
        e.setDetail(detail);
        LedgerEvent saved = repository.save(e);

        log.info("[{}] account={} counterparty={} track={} amount={} {}",
                type, account, counterparty, trackId, amount, detail == null ? "" : detail);
        return saved;
    }

    public LedgerEvent emit(LedgerEventType type, String account, String detail) {
        return emit(type, account, null, null, null, detail);
    }

    @Transactional(readOnly = true)
    public PageResponse<LedgerEventDto> list(Long trackId, int page, int limit) {
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.max(1, Math.min(limit, 200)));
        Page<LedgerEvent> events = trackId == null
                ? repository.findAllByOrderByIdAsc(pageable)
                : repository.findByTrackIdOrderByIdAsc(trackId, pageable);

        List<LedgerEventDto> items = events.getContent().stream()
                .map(LedgerEventDto::from)
                .toList();
        return new PageResponse<>(items, events.getTotalElements(), events.getTotalPages(),
                pageable.getPageNumber(), pageable.getPageSize());
    }

    @Transactional(readOnly = true)
    public List<LedgerEventDto> forTrack(Long trackId, LedgerEventType type) {
        return repository.findByTrackIdAndTypeOrderByIdAsc(trackId, type).stream()
                .map(LedgerEventDto::from)
                .toList();
    }
}
