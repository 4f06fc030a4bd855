package com.zktune.tunebackend.user.dto;

import com.zktune.tunebackend.user.Creator;

import java.time.Instant;

public record CreatorDto(
        Long id,
        String account,
        String name,
        String profileRef,
        Instant registeredAt
) {
    public static CreatorDto from(Creator c) {
        return new CreatorDto(c.getId(), c.getAccount(), c.getName(), c.getProfileRef(), c.getRegisteredAt());
    }
}
