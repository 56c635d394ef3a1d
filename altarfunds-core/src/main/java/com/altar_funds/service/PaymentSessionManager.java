package com.altar_funds.service;

import com.altar_funds.api.AltarFundsApiClient;
import com.altar_funds.api.dto.PaymentSessionRequest;
import com.altar_funds.api.dto.PaymentStatusPayload;
import com.altar_funds.config.AltarFundsProperties;
import com.altar_funds.event.PaymentResolvedEvent;
import com.altar_funds.exception.AmbiguousOutcomeException;
import com.altar_funds.exception.GivingValidationException;
import com.altar_funds.exception.NetworkException;
import com.altar_funds.exception.PaymentSessionNotFoundException;
import com.altar_funds.exception.ProviderDeclineException;
import com.altar_funds.model.CachedTransaction;
import com.altar_funds.model.GivingTransaction;
import com.altar_funds.model.PaymentSession;
import com.altar_funds.model.PaymentState;
import com.altar_funds.model.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Runs a gift from the amount the member typed to a completed or failed transaction.
 * <p>
 * {@link #initiate} validates the input and asks the backend for a payment session whose redirect
 * URL the presentation layer opens. Once the member comes back from the provider,
 * {@link #verify} polls the backend until it reports a terminal status or the attempt budget runs
 * out.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaymentSessionManager {

    static final String CHURCH_ID_KEY = "church_id";

    private final AltarFundsApiClient apiClient;
    private final PreferenceStore preferences;
    private final LocalCacheStore cacheStore;
    private final ApplicationEventPublisher events;
    private final AltarFundsProperties props;

    private final Map<String, PaymentSession> sessions = new ConcurrentHashMap<>();
    private final Deque<String> resolvedOrder = new ConcurrentLinkedDeque<>();

    public Mono<PaymentSession> initiate(BigDecimal amount, String category) {
        return Mono.defer(() -> {
            Optional<String> problem = validate(amount, category);
            if (problem.isPresent()) {
                return Mono.error(new GivingValidationException(problem.get()));
            }
            PaymentSession session = PaymentSession.draft(amount, category.trim());
            return preferences.getInt(CHURCH_ID_KEY, props.getPayment().getDefaultChurchId())
                    .flatMap(churchId -> {
                        session.submit(churchId);
                        log.info("Creating payment session: amount={} category={} church={}",
                                amount, session.getCategory(), churchId);
                        return apiClient.createPaymentSession(
                                new PaymentSessionRequest(amount, session.getCategory(), churchId));
                    })
                    .map(created -> {
                        session.awaitExternalConfirmation(created.reference(), created.redirectUrl());
                        sessions.put(created.reference(), session);
                        return session;
                    })
                    .doOnError(NetworkException.class, err -> {
                        log.warn("Payment session creation failed: {}", err.getMessage());
                        session.failSubmission(err.getMessage());
                    });
        });
    }

    /**
     * Resolves the outcome of a session after the member returns from the payment provider.
     *
     * @return the completed transaction; errors with {@link ProviderDeclineException} when the
     *         payment failed and {@link AmbiguousOutcomeException} when no final status was seen
     */
    public Mono<GivingTransaction> verify(String reference) {
        return Mono.defer(() -> {
            PaymentSession session = sessions.get(reference);
            if (session == null) {
                return Mono.error(new PaymentSessionNotFoundException(reference));
            }
            if (session.getState() == PaymentState.COMPLETED) {
                return Mono.just(session.getTransaction());
            }
            if (session.getState() == PaymentState.FAILED) {
                return Mono.error(new ProviderDeclineException(reference, session.getFailureMessage()));
            }
            if (!session.beginVerification()) {
                return Mono.error(new IllegalStateException("Payment " + reference + " is already being verified"));
            }
            return pollUntilTerminal(session)
                    .flatMap(payload -> resolve(session, payload))
                    .doOnTerminate(session::endVerification)
                    .doOnCancel(() -> {
                        log.info("Verification of payment {} abandoned", reference);
                        session.endVerification();
                    });
        });
    }

    public Optional<PaymentSession> find(String reference) {
        return Optional.ofNullable(sessions.get(reference));
    }

    private Mono<PaymentStatusPayload> pollUntilTerminal(PaymentSession session) {
        AltarFundsProperties.Payment policy = props.getPayment();
        String reference = session.getReference();
        return Mono.defer(() -> apiClient.getPaymentStatus(reference))
                .flatMap(payload -> TransactionStatus.fromRemote(payload.status()).isTerminal()
                        ? Mono.just(payload)
                        : Mono.<PaymentStatusPayload>error(new StillPendingException(payload.status())))
                .retryWhen(Retry.fixedDelay(policy.getMaxVerificationAttempts() - 1L, policy.getVerificationDelay())
                        .filter(err -> err instanceof StillPendingException || err instanceof NetworkException)
                        .doBeforeRetry(signal -> log.debug("Payment {} not final yet (attempt {}): {}",
                                reference, signal.totalRetries() + 1, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((backoff, signal) -> {
                            log.warn("Payment {} still unresolved after {} checks", reference, signal.totalRetries() + 1);
                            return new AmbiguousOutcomeException(reference, signal.totalRetries() + 1);
                        }));
    }

    private Mono<GivingTransaction> resolve(PaymentSession session, PaymentStatusPayload payload) {
        TransactionStatus outcome = TransactionStatus.fromRemote(payload.status());
        GivingTransaction resolved = GivingTransaction.builder()
                .id(payload.transactionId() != null ? payload.transactionId() : session.getReference())
                .categoryName(session.getCategory())
                .amount(payload.amount() != null ? payload.amount() : session.getAmount())
                .date(payload.processedAt() != null ? payload.processedAt() : payload.createdAt())
                .status(TransactionStatus.PENDING)
                .build()
                .resolve(outcome);

        return cacheStore.put(CachedTransaction.from(resolved))
                .then(Mono.fromRunnable(() -> {
                    if (outcome == TransactionStatus.COMPLETED) {
                        session.complete(resolved);
                    } else {
                        session.decline(resolved, payload.message());
                    }
                    log.info("Payment {} resolved as {}", session.getReference(), outcome);
                    retire(session.getReference());
                    events.publishEvent(new PaymentResolvedEvent(session.getReference(), resolved.id(), outcome));
                }))
                .then(outcome == TransactionStatus.COMPLETED
                        ? Mono.just(resolved)
                        : Mono.<GivingTransaction>error(new ProviderDeclineException(session.getReference(), payload.message())));
    }

    /**
     * Keeps the most recently resolved sessions answerable and forgets older ones.
     */
    private void retire(String reference) {
        resolvedOrder.addLast(reference);
        int retained = props.getPayment().getRetainedResolvedSessions();
        while (resolvedOrder.size() > retained) {
            String oldest = resolvedOrder.pollFirst();
            if (oldest != null) {
                sessions.remove(oldest);
                log.debug("Evicted resolved payment session {}", oldest);
            }
        }
    }

    private static Optional<String> validate(BigDecimal amount, String category) {
        if (amount == null || amount.signum() <= 0) {
            return Optional.of("Amount must be greater than zero");
        }
        if (category == null || category.isBlank()) {
            return Optional.of("Select a giving category");
        }
        return Optional.empty();
    }

    private static final class StillPendingException extends RuntimeException {
        StillPendingException(String status) {
            super("status " + status, null, false, false);
        }
    }
}
