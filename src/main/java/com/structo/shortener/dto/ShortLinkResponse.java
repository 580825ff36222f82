package com.structo.shortener.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShortLinkResponse {
    @JsonProperty("short_code")
    private String shortCode;
    @JsonProperty("short_url")
    private String shortUrl;
    @JsonProperty("original_url")
    private String originalUrl;
    @JsonProperty("created_at")
    private Instant createdAt;
    @JsonProperty("expires_at")
    private Instant expiresAt;
    @JsonProperty("click_count")
    private long clickCount;
    @JsonProperty("is_custom_code")
    private boolean customCode;
    // owner-only fields
    @JsonProperty("is_active")
    private Boolean active;
    @JsonProperty("is_expired")
    private Boolean expired;
}
