package com.zktune.tunebackend.user.dto;

import com.zktune.tunebackend.user.Consumer;

import java.time.Instant;

public record ConsumerDto(
        String account,
        String name,
        String profileRef,
        Instant registeredAt
) {
    public static ConsumerDto from(Consumer c) {
        return new ConsumerDto(c.getAccount(), c.getName(), c.getProfileRef(), c.getRegisteredAt());
    }
}
