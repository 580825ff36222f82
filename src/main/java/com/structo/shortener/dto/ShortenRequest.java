package com.structo.shortener.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ShortenRequest {
    @NotBlank
    @Size(max = 2048)
    private String url;

    @JsonProperty("custom_code")
    private String customCode;

    /** Seconds until the link expires; absent means never. */
    @Positive
    private Integer ttl;
}
