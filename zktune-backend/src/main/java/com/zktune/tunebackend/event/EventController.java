package com.zktune.tunebackend.event;

import com.zktune.tunebackend.event.dto.LedgerEventDto;
import com.zktune.tunebackend.shared.PageResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class EventController {

    private final LedgerEventService service;

    /**
     * Ledger events in the order they happened, optionally narrowed to one track.
     * Defaults: page=0, limit=50
     */
    @GetMapping
    public PageResponse<LedgerEventDto> list(
            @RequestParam(required = false) Long trackId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int limit
    ) {
        return service.list(trackId, page, limit);
    }
}
