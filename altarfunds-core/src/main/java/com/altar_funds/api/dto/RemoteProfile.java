package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoteProfile(
        Long id,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String email,
        Church church
) {
    public record Church(
            Long id,
            String name
    ) {}
}
