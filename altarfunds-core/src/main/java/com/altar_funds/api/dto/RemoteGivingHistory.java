package com.altar_funds.api.dto;

import java.util.List;

public record RemoteGivingHistory(
        List<RemoteTransaction> givings
) {}
