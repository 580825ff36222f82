package com.structo.shortener.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Returned by register and login; {@code token} goes into the {@code Authorization: Bearer} header.
 */
@Data
@AllArgsConstructor
public class AuthResponse {
    @JsonProperty("user_id")
    private Long userId;
    private String name;
    private String email;
    private String token;
}
