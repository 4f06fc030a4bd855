package com.zktune.tunebackend.ledger;

import com.zktune.tunebackend.gate.dto.WithdrawRequest;
import com.zktune.tunebackend.gate.dto.WithdrawResult;
import com.zktune.tunebackend.ledger.dto.StreamRequest;
import com.zktune.tunebackend.ledger.dto.StreamResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/tracks/{id}")
@RequiredArgsConstructor
public class StreamController {

    private final StreamingLedger ledger;

    @PostMapping("/stream")
    public ResponseEntity<StreamResponse> stream(@PathVariable Long id, @Valid @RequestBody StreamRequest request) {
        StreamResponse response = ledger.stream(request.getConsumer(), id, request.getPayment());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/access")
    public Map<String, Object> access(@PathVariable Long id, @RequestParam String consumer) {
        return Map.of(
                "trackId", id,
                "consumer", consumer,
                "granted", ledger.hasAccess(id, consumer)
        );
    }

    @PostMapping("/escrow/withdraw")
    public ResponseEntity<WithdrawResult> withdraw(@PathVariable Long id, @Valid @RequestBody WithdrawRequest request) {
        WithdrawResult result = ledger.withdrawEscrow(id, request.caller());
        log.info("Escrow of track {} withdrawn by {}: {}", id, result.payee(), result.amount());
        return ResponseEntity.ok(result);
    }
}
