package com.altar_funds.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "altarfunds")
public class AltarFundsProperties {
    @NotBlank
    private String baseUrl;
    private int connectTimeoutMillis = 5000;
    private int responseTimeoutMillis = 15000;

    @Valid
    private Payment payment = new Payment();
    @Valid
    private Cache cache = new Cache();
    @Valid
    private Display display = new Display();

    @Data
    public static class Payment {
        // used when no church has been picked on this device yet
        private int defaultChurchId = 1;
        @Min(1)
        private int maxVerificationAttempts = 10;
        @NotNull
        private Duration verificationDelay = Duration.ofSeconds(3);
        // resolved sessions kept for repeat verify calls, oldest evicted first
        @Min(1)
        private int retainedResolvedSessions = 100;
    }

    @Data
    public static class Cache {
        @Min(1)
        private int schemaVersion = 1;
    }

    @Data
    public static class Display {
        private String currencyCode = "KES";
        private String locale = "en-KE";
        private String datePattern = "MMM dd, yyyy";
    }
}
