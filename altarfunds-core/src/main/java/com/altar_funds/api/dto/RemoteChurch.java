package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoteChurch(
        String id,
        String name,
        String city,
        @JsonProperty("logo_url") String logoUrl
) {}
