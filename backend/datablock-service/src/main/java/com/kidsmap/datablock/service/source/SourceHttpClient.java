package com.kidsmap.datablock.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kidsmap.datablock.config.DataBlockProperties;
import com.kidsmap.datablock.exception.DataBlockException;
import com.kidsmap.datablock.exception.TransientNetworkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 소스 API 공통 GET 호출.
 *
 * 연결 오류, 타임아웃, 5xx, 429 는 maxAttempts 까지 1초부터 지수 백오프로 재시도하고
 * 소진되면 TransientNetworkException 을 던진다. 그 밖의 4xx 는 재시도 없이 SOURCE_ERROR.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SourceHttpClient {

    private static final Duration RETRY_MIN_BACKOFF = Duration.ofSeconds(1);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    /**
     * JSON 응답 조회. 본문을 JSON 으로 읽을 수 없으면 empty.
     */
    public Optional<JsonNode> getJson(String sourceName,
                                      DataBlockProperties.Source settings,
                                      URI uri,
                                      Consumer<HttpHeaders> headers) {
        String body = getBody(sourceName, settings, uri, headers);
        if (body == null || body.isBlank()) {
            log.warn("[{}] Empty response body: {}", sourceName, uri.getPath());
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readTree(body));
        } catch (Exception e) {
            log.warn("[{}] Unparseable response body, skipping page: {}", sourceName, e.getMessage());
            return Optional.empty();
        }
    }

    private String getBody(String sourceName,
                           DataBlockProperties.Source settings,
                           URI uri,
                           Consumer<HttpHeaders> headers) {
        int retries = Math.max(0, settings.getMaxAttempts() - 1);
        try {
            return webClient.get()
                    .uri(uri)
                    .headers(headers)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(settings.getRequestTimeoutMs()))
                    .retryWhen(Retry.backoff(retries, RETRY_MIN_BACKOFF)
                            .filter(SourceHttpClient::isTransient)
                            .doBeforeRetry(signal -> log.warn("[{}] Transient failure, retry {}/{}: {}",
                                    sourceName, signal.totalRetries() + 1, retries, signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) ->
                                    TransientNetworkException.retriesExhausted(sourceName, signal.failure())))
                    .block();
        } catch (DataBlockException e) {
            throw e;
        } catch (WebClientResponseException e) {
            if (isTransient(e)) {
                throw TransientNetworkException.retriesExhausted(sourceName, e);
            }
            throw DataBlockException.sourceError(sourceName,
                    "HTTP " + e.getStatusCode().value() + " " + e.getStatusText(), e);
        } catch (RuntimeException e) {
            if (isTransient(e) || isTransient(e.getCause())) {
                throw TransientNetworkException.retriesExhausted(sourceName, e);
            }
            throw DataBlockException.sourceError(sourceName, e.getMessage(), e);
        }
    }

    /**
     * 재시도 대상 오류 판별
     */
    static boolean isTransient(Throwable e) {
        if (e == null) return false;
        if (e instanceof TimeoutException || e instanceof WebClientRequestException) {
            return true;
        }
        if (e instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) e).getStatusCode().value();
            return status >= 500 || status == 429;
        }
        return false;
    }
}
