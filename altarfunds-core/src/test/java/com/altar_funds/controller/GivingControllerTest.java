package com.altar_funds.controller;

import com.altar_funds.dto.CachedRead;
import com.altar_funds.exception.AmbiguousOutcomeException;
import com.altar_funds.exception.GivingValidationException;
import com.altar_funds.exception.NetworkException;
import com.altar_funds.exception.PaymentSessionNotFoundException;
import com.altar_funds.exception.ProviderDeclineException;
import com.altar_funds.format.IsoTransactionDateFormatter;
import com.altar_funds.format.LocaleCurrencyFormatter;
import com.altar_funds.model.GivingTransaction;
import com.altar_funds.model.PaymentSession;
import com.altar_funds.model.TransactionStatus;
import com.altar_funds.service.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Currency;
import java.util.List;
import java.util.Locale;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GivingController")
class GivingControllerTest {

    @Mock
    private DashboardAggregator dashboardAggregator;
    @Mock
    private PaymentSessionManager paymentSessionManager;
    @Mock
    private CacheSyncService cacheSyncService;
    @Mock
    private RecurringGivingService recurringGivingService;
    @Mock
    private PledgeService pledgeService;

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        TransactionListProjection projection = new TransactionListProjection(
                new LocaleCurrencyFormatter(Locale.US, Currency.getInstance("KES")),
                new IsoTransactionDateFormatter("MMM dd, yyyy", Locale.ENGLISH));
        GivingController controller = new GivingController(dashboardAggregator, paymentSessionManager,
                cacheSyncService, projection, recurringGivingService, pledgeService);
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("POST /giving answers 201 with the redirect URL")
    void giveCreatesSession() {
        PaymentSession session = PaymentSession.draft(new BigDecimal("500"), "Tithe");
        session.submit(1);
        session.awaitExternalConfirmation("AF-1", "https://pay.example/AF-1");
        when(paymentSessionManager.initiate(any(), eq("Tithe"))).thenReturn(Mono.just(session));

        client.post().uri("/api/v1/giving")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 500, \"category\": \"Tithe\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.reference").isEqualTo("AF-1")
                .jsonPath("$.data.redirect_url").isEqualTo("https://pay.example/AF-1")
                .jsonPath("$.data.state").isEqualTo("AWAITING_EXTERNAL_CONFIRMATION")
                .jsonPath("$.data.church_id").isEqualTo(1);
    }

    @Test
    @DisplayName("POST /giving with invalid input answers 400")
    void giveRejected() {
        when(paymentSessionManager.initiate(any(), any()))
                .thenReturn(Mono.error(new GivingValidationException("Amount must be greater than zero")));

        client.post().uri("/api/v1/giving")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"amount\": 0, \"category\": \"Tithe\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("Amount must be greater than zero");
    }

    @Test
    @DisplayName("verify maps each outcome to its status code")
    void verifyOutcomes() {
        when(paymentSessionManager.verify("ok")).thenReturn(Mono.just(GivingTransaction.builder()
                .id("txn-9").categoryName("Tithe").amount(new BigDecimal("500"))
                .date("2024-03-01T10:00:00").status(TransactionStatus.COMPLETED).build()));
        when(paymentSessionManager.verify("declined"))
                .thenReturn(Mono.error(new ProviderDeclineException("declined", "Insufficient funds")));
        when(paymentSessionManager.verify("unknown"))
                .thenReturn(Mono.error(new AmbiguousOutcomeException("unknown", 10)));
        when(paymentSessionManager.verify("missing"))
                .thenReturn(Mono.error(new PaymentSessionNotFoundException("missing")));
        when(paymentSessionManager.verify("busy"))
                .thenReturn(Mono.error(new IllegalStateException("Payment busy is already being verified")));

        client.post().uri("/api/v1/giving/ok/verify").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.status").isEqualTo("COMPLETED")
                .jsonPath("$.data.status_label").isEqualTo("Completed")
                .jsonPath("$.data.date").isEqualTo("Mar 01, 2024");
        client.post().uri("/api/v1/giving/declined/verify").exchange()
                .expectStatus().isEqualTo(402);
        client.post().uri("/api/v1/giving/unknown/verify").exchange()
                .expectStatus().isAccepted()
                .expectBody().jsonPath("$.success").isEqualTo(false);
        client.post().uri("/api/v1/giving/missing/verify").exchange()
                .expectStatus().isNotFound();
        client.post().uri("/api/v1/giving/busy/verify").exchange()
                .expectStatus().isEqualTo(409);
    }

    @Test
    @DisplayName("backend failures answer 502 with a generic message")
    void networkFailure() {
        when(recurringGivingService.list()).thenReturn(Mono.error(new NetworkException("Recurring giving fetch failed: timeout")));

        client.get().uri("/api/v1/recurring").exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Could not reach AltarFunds, please try again");
    }

    @Test
    @DisplayName("GET /transactions projects cached reads and flags staleness")
    void transactionsFromCache() {
        when(cacheSyncService.givingHistory(50)).thenReturn(Mono.just(CachedRead.fromCache(List.of(
                GivingTransaction.builder().id("t1").categoryName(null).amount(BigDecimal.ONE)
                        .date("garbage").status(TransactionStatus.PENDING).build()))));

        client.get().uri("/api/v1/transactions").exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.stale").isEqualTo(true)
                .jsonPath("$.data.items[0].category").isEqualTo("General")
                .jsonPath("$.data.items[0].date").isEqualTo("garbage");
    }

    @Test
    @DisplayName("GET /transactions rejects a limit below one without calling the backend")
    void transactionsRejectsNonPositiveLimit() {
        client.get().uri("/api/v1/transactions?limit=0").exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("limit must be at least 1");
        client.get().uri("/api/v1/transactions?limit=-3").exchange()
                .expectStatus().isBadRequest();

        verifyNoInteractions(cacheSyncService);
    }
}
