package com.zktune.tunebackend.ledger;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.gate.AccessGateService;
import com.zktune.tunebackend.gate.dto.AccessGateInfo;
import com.zktune.tunebackend.gate.dto.AccessResult;
import com.zktune.tunebackend.gate.dto.WithdrawResult;
import com.zktune.tunebackend.ledger.dto.CreatorPayoutsDto;
import com.zktune.tunebackend.ledger.dto.CreatorSummaryDto;
import com.zktune.tunebackend.ledger.dto.PlayRecordDto;
import com.zktune.tunebackend.ledger.dto.StreamResponse;
import com.zktune.tunebackend.payout.PayoutRepository;
import com.zktune.tunebackend.payout.dto.PayoutDto;
import com.zktune.tunebackend.shared.Accounts;
import com.zktune.tunebackend.shared.LedgerTransactions;
import com.zktune.tunebackend.track.Catalog;
import com.zktune.tunebackend.track.Track;
import com.zktune.tunebackend.track.TrackRepository;
import com.zktune.tunebackend.track.dto.TrackDto;
import com.zktune.tunebackend.user.IdentityRegistry;
import com.zktune.tunebackend.user.dto.ConsumerDto;
import com.zktune.tunebackend.user.dto.CreatorDto;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for everything the transport layer can ask of the ledger. Writes go through
 * {@link LedgerTransactions}, so each one is applied entirely or not at all and never interleaves
 * with another write.
 */
@Service
@RequiredArgsConstructor
public class StreamingLedger {

    private final IdentityRegistry identityRegistry;
    private final Catalog catalog;
    private final AccessGateService accessGateService;
    private final TrackRepository trackRepository;
    private final PlayRecordRepository playRecordRepository;
    private final PayoutRepository payoutRepository;
    private final LedgerEventService events;
    private final LedgerTransactions tx;

    // --- registration & publishing ---

    public Long registerCreator(String account, String name, String profileRef) {
        return identityRegistry.registerCreator(account, name, profileRef);
    }

    public void registerConsumer(String account, String name, String profileRef) {
        identityRegistry.registerConsumer(account, name, profileRef);
    }

    public Long publish(String creatorAccount, String title, String audioRef, String coverRef,
                        long unitPrice, Integer royaltyBasisPoints) {
        return catalog.publish(creatorAccount, title, audioRef, coverRef, unitPrice, royaltyBasisPoints);
    }

    // --- playback ---

    /**
     * Plays a track: confirms or buys access, then counts the play and appends it to the consumer's
     * history. If access is refused nothing is recorded.
     *
     * @param payment amount offered; ignored when the consumer already holds a grant
     */
    public StreamResponse stream(String consumerAccount, Long workId, long payment) {
        String consumer = Accounts.require(consumerAccount, "Consumer");

        return tx.write(() -> {
            Track track = catalog.getWorkForUpdate(workId);
            AccessResult access = accessGateService.requestAccess(track, consumer, payment);

            track.incrementPlayCount();
            trackRepository.save(track);
            PlayRecord play = playRecordRepository.save(new PlayRecord(track.getId(), consumer, access.settled()));

            events.emit(LedgerEventType.PLAYED, consumer, track.getCreator().getAccount(), track.getId(), null,
                    "play #" + track.getPlayCount());
            return new StreamResponse(track.getId(), track.getAudioRef(), access.settled(),
                    access.royaltyShare(), track.getPlayCount(), play.getId());
        });
    }

    public WithdrawResult withdrawEscrow(Long workId, String callerAccount) {
        return tx.write(() -> accessGateService.withdrawEscrow(catalog.getWorkForUpdate(workId), callerAccount));
    }

    // --- reads ---

    @Transactional(readOnly = true)
    public boolean hasAccess(Long workId, String consumerAccount) {
        return accessGateService.hasAccess(catalog.findWork(workId), consumerAccount);
    }

    @Transactional(readOnly = true)
    public AccessGateInfo gateInfo(Long workId) {
        return accessGateService.info(catalog.findWork(workId));
    }

    public TrackDto getWork(Long workId) {
        return catalog.getWork(workId);
    }

    public List<TrackDto> allWorks() {
        return catalog.listAll();
    }

    public List<TrackDto> worksByCreator(String creatorAccount) {
        return catalog.listByCreator(creatorAccount);
    }

    @Transactional(readOnly = true)
    public List<PlayRecordDto> playHistory(String consumerAccount) {
        if (consumerAccount == null) return List.of();
        return playRecordRepository.findByConsumerAccountOrderByIdAsc(consumerAccount.strip()).stream()
                .map(PlayRecordDto::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public Optional<CreatorSummaryDto> creatorSummary(String creatorAccount) {
        return identityRegistry.findCreator(creatorAccount).map(c -> new CreatorSummaryDto(
                CreatorDto.from(c),
                trackRepository.countByCreatorAccount(c.getAccount()),
                trackRepository.sumPlayCountByCreatorAccount(c.getAccount()),
                payoutRepository.sumAmountByCreatorAccount(c.getAccount())
        ));
    }

    @Transactional(readOnly = true)
    public Optional<ConsumerDto> consumer(String consumerAccount) {
        return identityRegistry.findConsumer(consumerAccount).map(ConsumerDto::from);
    }

    @Transactional(readOnly = true)
    public CreatorPayoutsDto payouts(String creatorAccount) {
        String account = creatorAccount == null ? "" : creatorAccount.strip();
        List<PayoutDto> items = payoutRepository.findByCreatorAccountOrderByIdAsc(account).stream()
                .map(PayoutDto::from)
                .toList();
        return new CreatorPayoutsDto(account, payoutRepository.sumAmountByCreatorAccount(account), items);
    }
}
