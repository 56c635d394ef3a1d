package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoteCategory(
        String id,
        String name,
        String description,
        @JsonProperty("is_active") Boolean active
) {}
