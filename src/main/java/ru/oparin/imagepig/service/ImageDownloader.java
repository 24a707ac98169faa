package ru.oparin.imagepig.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Загрузка готового изображения по URL из ответа API.
 * <p>
 * API возвращает URL раньше, чем файл становится доступен в хранилище, поэтому
 * ответ 404 означает "еще не готово": загрузка повторяется с паузой, пока не закончатся попытки.
 * Любой другой неуспешный статус или ошибка транспорта прекращают загрузку сразу.
 */
@Slf4j
public class ImageDownloader {

    private final WebClient webClient;
    private final int attempts;
    private final Duration interruption;

    public ImageDownloader(WebClient.Builder webClientBuilder, ImagePigProperties.Download properties) {
        this.webClient = webClientBuilder.clone()
                .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
                .build();
        this.attempts = Math.max(1, properties.getAttempts());
        this.interruption = Duration.ofMillis(Math.max(0, properties.getInterruptionMs()));
    }

    /**
     * Загрузить изображение.
     *
     * @param url URL изображения
     * @return байты изображения или ошибка {@link ImagePigErrorType#MISSING_DATA}
     */
    public Mono<byte[]> download(String url) {
        AtomicInteger attempt = new AtomicInteger();
        return Mono.defer(() -> fetchOnce(url, attempt.incrementAndGet()))
                .flatMap(result -> switch (result.getOutcome()) {
                    case SUCCESS -> Mono.just(result.getData());
                    case RETRYABLE -> Mono.<byte[]>error(new ImageNotReadyException());
                    case FATAL -> Mono.<byte[]>error(missingData(url));
                })
                .retryWhen(Retry.fixedDelay(attempts - 1, interruption)
                        .filter(ImageNotReadyException.class::isInstance)
                        .doBeforeRetry(signal -> log.debug("Изображение {} еще не доступно, повторная попытка ({}/{})",
                                url, signal.totalRetries() + 2, attempts))
                        .onRetryExhaustedThrow((spec, signal) -> {
                            log.warn("Изображение {} не стало доступно за {} попыток", url, attempts);
                            return missingData(url);
                        }));
    }

    /**
     * Одна попытка загрузки.
     */
    private Mono<DownloadAttempt> fetchOnce(String url, int attempt) {
        log.debug("Загрузка изображения {}, попытка {}/{}", url, attempt, attempts);
        URI uri = toUri(url);
        if (uri == null) {
            log.warn("Некорректный URL изображения в ответе: {}", url);
            return Mono.just(DownloadAttempt.transportFailure());
        }
        return webClient.get()
                .uri(uri)
                .exchangeToMono(this::toAttempt)
                .onErrorResume(WebClientRequestException.class, e -> {
                    log.warn("Ошибка подключения при загрузке изображения {}: {}", url, e.getMessage());
                    return Mono.just(DownloadAttempt.transportFailure());
                });
    }

    private Mono<DownloadAttempt> toAttempt(ClientResponse response) {
        int statusCode = response.statusCode().value();
        return switch (DownloadAttempt.classify(response.statusCode())) {
            case SUCCESS -> response.bodyToMono(byte[].class)
                    .defaultIfEmpty(new byte[0])
                    .map(data -> DownloadAttempt.success(data, statusCode))
                    .onErrorMap(e -> !(e instanceof ImagePigException), e -> new ImagePigException(
                            ImagePigErrorType.HTTP_ERROR, "Не удалось прочитать тело ответа: " + e.getMessage(), e));
            case RETRYABLE -> response.releaseBody().thenReturn(DownloadAttempt.retryable(statusCode));
            case FATAL -> {
                log.warn("Загрузка изображения прервана, статус {}", statusCode);
                yield response.releaseBody().thenReturn(DownloadAttempt.fatal(statusCode));
            }
        };
    }

    private static URI toUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            URI uri = new URI(url);
            return uri.isAbsolute() ? uri : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static ImagePigException missingData(String url) {
        return new ImagePigException(ImagePigErrorType.MISSING_DATA,
                String.format(ImagePigConstants.ErrorMessages.DOWNLOAD_FAILED, url));
    }

    /**
     * Сигнал повторной попытки: файл еще не доступен.
     */
    private static class ImageNotReadyException extends RuntimeException {
        ImageNotReadyException() {
            super("Изображение еще не доступно", null, false, false);
        }
    }
}
