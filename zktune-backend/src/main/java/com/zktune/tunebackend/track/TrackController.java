package com.zktune.tunebackend.track;

import com.zktune.tunebackend.gate.dto.AccessGateInfo;
import com.zktune.tunebackend.ledger.StreamingLedger;
import com.zktune.tunebackend.track.dto.PublishRequest;
import com.zktune.tunebackend.track.dto.TrackDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/tracks")
@RequiredArgsConstructor
public class TrackController {

    private final StreamingLedger ledger;

    @PostMapping
    public ResponseEntity<TrackDto> publish(@Valid @RequestBody PublishRequest request) {
        Long id = ledger.publish(
                request.getCreator(),
                request.getTitle(),
                request.getAudioRef(),
                request.getCoverRef(),
                request.getUnitPrice(),
                request.getRoyaltyBasisPoints()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(ledger.getWork(id));
    }

    @GetMapping
    public List<TrackDto> all() {
        return ledger.allWorks();
    }

    @GetMapping("/{id}")
    public TrackDto get(@PathVariable Long id) {
        return ledger.getWork(id);
    }

    @GetMapping("/{id}/gate")
    public AccessGateInfo gate(@PathVariable Long id) {
        return ledger.gateInfo(id);
    }
}
