package com.altar_funds.api.dto;

/**
 * Wrapper the backend puts around most payloads.
 */
public record ApiEnvelope<T>(
        boolean success,
        T data,
        String message
) {}
