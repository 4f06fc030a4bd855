package com.zktune.tunebackend.track;

import com.zktune.tunebackend.track.dto.TrackDto;

public class TrackMapper {

    public static TrackDto mapToDto(Track track) {
        return new TrackDto(
                track.getId(),
                track.getCreator() != null ? track.getCreator().getId() : null,
                track.getCreator() != null ? track.getCreator().getAccount() : null,
                track.getCreator() != null ? track.getCreator().getName() : null,
                track.getTitle(),
                track.getAudioRef(),
                track.getCoverRef(),
                track.getPlayCount(),
                track.getGate().getUnitPrice(),
                track.getGate().getRoyaltyBasisPoints(),
                track.getPublishedAt()
        );
    }
}
