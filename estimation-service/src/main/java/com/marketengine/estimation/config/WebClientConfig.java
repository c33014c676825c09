package com.marketengine.estimation.config;

import com.marketengine.common.exception.MarketEngineException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${services.listings.base-url}")
    private String listingsBaseUrl;

    @Value("${services.enrichment.base-url}")
    private String enrichmentBaseUrl;

    @Bean
    public WebClient listingWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(listingsBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(10)))
            .filter(serverErrorFilter("ListingClient"))
            .filter(loggingFilter())
            .build();
    }

    @Bean
    public WebClient enrichmentWebClient(WebClient.Builder builder) {
        return builder.clone()
            .baseUrl(enrichmentBaseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient(5)))
            .filter(serverErrorFilter("EnrichmentClient"))
            .filter(loggingFilter())
            .build();
    }

    private static HttpClient httpClient(int timeoutSeconds) {
        return HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(timeoutSeconds))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
    }

    private static ExchangeFilterFunction serverErrorFilter(String component) {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().is5xxServerError()) {
                return Mono.error(new MarketEngineException(component,
                    "upstream server error: " + clientResponse.statusCode()));
            }
            return Mono.just(clientResponse);
        });
    }

    private static ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            String sanitized = clientRequest.url().toString().replaceAll("api_key=[^&]+", "api_key=***");
            log.debug("Outbound request: {} {}", clientRequest.method(), sanitized);
            return Mono.just(clientRequest);
        });
    }
}
