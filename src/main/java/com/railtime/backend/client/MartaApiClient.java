package com.railtime.backend.client;

import com.railtime.backend.exception.UpstreamException;
import com.railtime.backend.util.UpstreamUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.CodecException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.UnsupportedMediaTypeException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class MartaApiClient implements MartaApi {

        static final int MALFORMED_PAYLOAD_STATUS = 502;

        private static final ParameterizedTypeReference<List<Map<String, Object>>> ARRIVALS_TYPE = new ParameterizedTypeReference<>() {
        };

        private final WebClient webClient;
        private final UpstreamRateLimiter rateLimiter;
        private final int apiTimeout;

        public MartaApiClient(WebClient.Builder webClientBuilder,
                        UpstreamRateLimiter rateLimiter,
                        @Value("${marta.api.base-url}") String baseUrl,
                        @Value("${marta.api.timeout-seconds:10}") int apiTimeout) {
                this.rateLimiter = rateLimiter;
                this.apiTimeout = apiTimeout;
                this.webClient = webClientBuilder
                                .baseUrl(baseUrl)
                                .codecs(configurer -> configurer
                                                .defaultCodecs()
                                                .maxInMemorySize(2 * 1024 * 1024)) // 2MB
                                .build();
        }

        @Override
        public List<Map<String, Object>> fetchArrivals(String apiKey) {
                rateLimiter.acquire();
                long startMillis = System.currentTimeMillis();
                log.info("📡 Fetching rail arrivals from MARTA API...");

                List<Map<String, Object>> arrivals;
                try {
                        arrivals = webClient.get()
                                        .uri(uriBuilder -> uriBuilder
                                                        .queryParam("apiKey", "{apiKey}")
                                                        .build(apiKey))
                                        .accept(MediaType.APPLICATION_JSON)
                                        .retrieve()
                                        .bodyToMono(ARRIVALS_TYPE)
                                        .timeout(Duration.ofSeconds(apiTimeout))
                                        .block();
                } catch (WebClientResponseException e) {
                        if (e.getStatusCode().is2xxSuccessful()) {
                                // A 2xx here means the body could not be decoded (e.g. an HTML maintenance page)
                                log.warn("❌ MARTA API returned an unreadable {} payload: {}",
                                                e.getStatusCode().value(), e.getMessage());
                                throw UpstreamException.of(MALFORMED_PAYLOAD_STATUS, "Malformed response: " + e.getMessage(), e);
                        }
                        int status = e.getStatusCode().value();
                        log.warn("❌ MARTA API responded {} | Took: {}ms", status, System.currentTimeMillis() - startMillis);
                        throw UpstreamException.of(status, e.getResponseBodyAsString(), e);
                } catch (CodecException | UnsupportedMediaTypeException e) {
                        log.warn("❌ MARTA API returned a malformed payload: {}", e.getMessage());
                        throw UpstreamException.of(MALFORMED_PAYLOAD_STATUS, "Malformed response: " + e.getMessage(), e);
                } catch (RuntimeException e) {
                        // Connection failures and timeouts count as upstream-internal errors
                        Throwable cause = Exceptions.unwrap(e);
                        String detail = cause.getMessage() != null ? cause.getMessage() : UpstreamUtils.UNKNOWN_ERROR;
                        log.warn("❌ MARTA API call failed: {} | Took: {}ms", detail, System.currentTimeMillis() - startMillis);
                        throw UpstreamException.of(UpstreamException.INTERNAL_ERROR_STATUS, detail, cause);
                }

                if (arrivals == null) {
                        throw UpstreamException.of(MALFORMED_PAYLOAD_STATUS, UpstreamUtils.NO_RESPONSE_BODY);
                }

                log.info("✅ Received {} arrivals from MARTA API | Took: {}ms", arrivals.size(),
                                System.currentTimeMillis() - startMillis);
                return arrivals;
        }
}
