package com.zktune.tunebackend.user;

import com.zktune.tunebackend.ledger.StreamingLedger;
import com.zktune.tunebackend.ledger.dto.CreatorPayoutsDto;
import com.zktune.tunebackend.ledger.dto.CreatorSummaryDto;
import com.zktune.tunebackend.ledger.dto.PlayRecordDto;
import com.zktune.tunebackend.track.dto.TrackDto;
import com.zktune.tunebackend.user.dto.ConsumerDto;
import com.zktune.tunebackend.user.dto.RegisterRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UserController {

    private final StreamingLedger ledger;

    // --- creators ---

    @PostMapping("/creators")
    public ResponseEntity<Map<String, Object>> registerCreator(@Valid @RequestBody RegisterRequest request) {
        Long id = ledger.registerCreator(request.getAccount(), request.getName(), request.getProfileRef());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("id", id, "account", request.getAccount().strip()));
    }

    @GetMapping("/creators/{account}")
    public CreatorSummaryDto getCreator(@PathVariable String account) {
        return ledger.creatorSummary(account)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Creator not found"));
    }

    @GetMapping("/creators/{account}/tracks")
    public List<TrackDto> creatorTracks(@PathVariable String account) {
        return ledger.worksByCreator(account);
    }

    @GetMapping("/creators/{account}/payouts")
    public CreatorPayoutsDto creatorPayouts(@PathVariable String account) {
        return ledger.payouts(account);
    }

    // --- consumers ---

    @PostMapping("/consumers")
    public ResponseEntity<Map<String, Object>> registerConsumer(@Valid @RequestBody RegisterRequest request) {
        ledger.registerConsumer(request.getAccount(), request.getName(), request.getProfileRef());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("account", request.getAccount().strip()));
    }

    @GetMapping("/consumers/{account}")
    public ConsumerDto getConsumer(@PathVariable String account) {
        return ledger.consumer(account)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Consumer not found"));
    }

    @GetMapping("/consumers/{account}/plays")
    public List<PlayRecordDto> consumerPlays(@PathVariable String account) {
        return ledger.playHistory(account);
    }
}
