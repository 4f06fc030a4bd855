package com.zktune.tunebackend.track;

import com.zktune.tunebackend.event.LedgerEventService;
import com.zktune.tunebackend.event.LedgerEventType;
import com.zktune.tunebackend.gate.AccessGate;
import com.zktune.tunebackend.shared.Accounts;
import com.zktune.tunebackend.shared.LedgerError;
import com.zktune.tunebackend.shared.LedgerException;
import com.zktune.tunebackend.shared.LedgerTransactions;
import com.zktune.tunebackend.track.dto.TrackDto;
import com.zktune.tunebackend.user.Creator;
import com.zktune.tunebackend.user.CreatorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class Catalog {

    private final TrackRepository trackRepository;
    private final CreatorRepository creatorRepository;
    private final LedgerEventService events;
    private final LedgerTransactions tx;

    @Value("${app.ledger.royalty-basis-points:3000}")
    private int defaultRoyaltyBasisPoints = AccessGate.DEFAULT_ROYALTY_BASIS_POINTS;

    public Long publish(String creatorAccount, String title, String audioRef, String coverRef, long unitPrice) {
        return publish(creatorAccount, title, audioRef, coverRef, unitPrice, null);
    }

    /**
     * Publishes a track and creates its access gate in the same step.
     *
     * @param royaltyBasisPoints royalty rate for the gate, or null for the configured default
     * @return the new track id, always 1 or more
     */
    public Long publish(String creatorAccount, String title, String audioRef, String coverRef,
                        long unitPrice, Integer royaltyBasisPoints) {
        String key = Accounts.require(creatorAccount, "Creator");
        int rate = royaltyBasisPoints != null ? royaltyBasisPoints : defaultRoyaltyBasisPoints;

        return tx.write(() -> {
            Creator creator = creatorRepository.findByAccount(key)
                    .orElseThrow(() -> new LedgerException(LedgerError.NOT_REGISTERED_CREATOR,
                            "Not a registered creator: " + key));

            // validates price and rate before anything is stored
            AccessGate gate = new AccessGate(creator, unitPrice, rate);

            Track track = new Track();
            track.setCreator(creator);
            track.setTitle(Accounts.orEmpty(title));
            track.setAudioRef(Accounts.orEmpty(audioRef));
            track.setCoverRef(Accounts.orEmpty(coverRef));
            track.setGate(gate);
            Track saved = trackRepository.save(track);

            events.emit(LedgerEventType.TRACK_PUBLISHED, key, null, saved.getId(), unitPrice,
                    "'" + saved.getTitle() + "' at " + rate + "bp");
            return saved.getId();
        });
    }

    /** Loads the track entity; id 0, null and unassigned ids are all {@code WORK_NOT_FOUND}. */
    public Track findWork(Long workId) {
        if (workId == null || workId <= 0) {
            throw new LedgerException(LedgerError.WORK_NOT_FOUND, "Track not found: " + workId);
        }
        return trackRepository.findById(workId)
                .orElseThrow(() -> new LedgerException(LedgerError.WORK_NOT_FOUND, "Track not found: " + workId));
    }

    /** Loads the track entity for a write already running inside the ledger boundary. */
    public Track getWorkForUpdate(Long workId) {
        if (!tx.isHeldByCurrentThread()) {
            throw new IllegalStateException("Track " + workId + " loaded for update outside a ledger write");
        }
        return findWork(workId);
    }

    @Transactional(readOnly = true)
    public TrackDto getWork(Long workId) {
        return TrackMapper.mapToDto(findWork(workId));
    }

    @Transactional(readOnly = true)
    public List<TrackDto> listAll() {
        return trackRepository.findAllByOrderByIdAsc().stream()
                .map(TrackMapper::mapToDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<TrackDto> listByCreator(String creatorAccount) {
        if (creatorAccount == null) return List.of();
        return trackRepository.findByCreatorAccountOrderByIdAsc(creatorAccount.strip()).stream()
                .map(TrackMapper::mapToDto)
                .toList();
    }

    @Transactional(readOnly = true)
    public long size() {
        return trackRepository.count();
    }
}
