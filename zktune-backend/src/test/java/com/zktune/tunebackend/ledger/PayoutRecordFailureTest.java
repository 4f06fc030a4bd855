package com.zktune.tunebackend.ledger;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.payout.PaymentTransferService;
import com.zktune.tunebackend.payout.Payout;
import com.zktune.tunebackend.payout.PayoutRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringBootTest
class PayoutRecordFailureTest {

    @Autowired private StreamingLedger ledger;
    @Autowired private LedgerEventService events;

    @MockBean private PayoutRepository payoutRepository;
    @MockBean private PaymentTransferService paymentTransferService;

    private String artist;
    private Long trackId;

    @BeforeEach
    void setUp() {
        artist = "artist-" + UUID.randomUUID();
        ledger.registerCreator(artist, "Artist", "");
        trackId = ledger.publish(artist, "Unrecorded", "audio/u.mp3", "", 1000L, null);
        ledger.stream("fan-" + artist, trackId, 1000);
        when(payoutRepository.save(any(Payout.class)))
                .thenThrow(new DataIntegrityViolationException("payouts table unavailable"));
    }

    @Test
    void shouldNotMoveMoneyWhenPayoutCannotBeRecorded() {
        assertThrows(DataIntegrityViolationException.class, () -> ledger.withdrawEscrow(trackId, artist));
        assertThrows(DataIntegrityViolationException.class, () -> ledger.withdrawEscrow(trackId, artist));

        verify(paymentTransferService, never()).transfer(anyString(), anyLong());
        assertEquals(300, ledger.gateInfo(trackId).escrowBalance());
        assertEquals(0, ledger.gateInfo(trackId).totalPaidOut());
        assertTrue(events.forTrack(trackId, LedgerEventType.ROYALTY_PAID).isEmpty());
    }
}
