package com.altar_funds.dto;

import com.altar_funds.model.FinancialSummary;
import com.altar_funds.model.MemberProfile;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;
import java.util.Optional;

public record DashboardSnapshot(
        @JsonProperty("profile") Optional<MemberProfile> profile,
        @JsonProperty("summary") FinancialSummary summary,
        @JsonProperty("recent") RecentTransactions recent,
        @JsonProperty("loaded_at") OffsetDateTime loadedAt
) {}
