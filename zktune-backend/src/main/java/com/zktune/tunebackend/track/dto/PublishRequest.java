package com.zktune.tunebackend.track.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {

    @NotBlank
    private String creator;

    @NotBlank
    @Size(max = 255)
    private String title;

    @NotBlank
    @Size(max = 1024)
    private String audioRef;

    @Size(max = 1024)
    private String coverRef;

    @NotNull
    @Min(0)
    private Long unitPrice;

    // null means the configured default
    @Min(0)
    @Max(10_000)
    private Integer royaltyBasisPoints;
}
