package com.altar_funds.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RemoteNotification(
        String id,
        String title,
        String message,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("is_read") Boolean read
) {}
