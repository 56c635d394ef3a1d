package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.dto.PledgeProgress;
import com.altar_funds.model.Pledge;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

@Service
@RequiredArgsConstructor
public class PledgeService {

    private final AltarFundsApiClient apiClient;

    public Mono<List<PledgeProgress>> pledges() {
        return apiClient.getPledges()
                .map(list -> list.stream()
                        .map(Pledge::from)
                        .map(PledgeProgress::from)
                        .toList());
    }
}
