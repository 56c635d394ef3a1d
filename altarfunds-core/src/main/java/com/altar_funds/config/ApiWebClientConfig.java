package com.altar_funds.config;

import java.time.Duration;

import com.altar_funds.service.PreferenceStore;
import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
@EnableConfigurationProperties(AltarFundsProperties.class)
public class ApiWebClientConfig {

    static final String AUTH_TOKEN_KEY = "auth_token";

    @Bean
    @Qualifier("altarFundsWebClient")
    public WebClient altarFundsWebClient(AltarFundsProperties props, PreferenceStore preferences) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getConnectTimeoutMillis())
                .responseTimeout(Duration.ofMillis(props.getResponseTimeoutMillis()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(4 * 1024 * 1024)) // 4 MB
                .build();

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .filter(bearerToken(preferences))
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * Attaches the stored session token, if any. Requests go out unauthenticated when the
     * member has not signed in on this device.
     */
    static ExchangeFilterFunction bearerToken(PreferenceStore preferences) {
        return ExchangeFilterFunction.ofRequestProcessor(request ->
                preferences.getString(AUTH_TOKEN_KEY, "")
                        .map(token -> token.isBlank()
                                ? request
                                : ClientRequest.from(request)
                                        .headers(h -> h.setBearerAuth(token))
                                        .build()));
    }
}
