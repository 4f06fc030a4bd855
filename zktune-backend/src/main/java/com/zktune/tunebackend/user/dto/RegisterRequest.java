package com.zktune.tunebackend.user.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegisterRequest {

    @NotBlank
    @Size(max = 255)
    private String account;

    // may be empty; presence is decided by the account, never by the name
    @Size(max = 255)
    private String name;

    @Size(max = 1024)
    private String profileRef;
}
