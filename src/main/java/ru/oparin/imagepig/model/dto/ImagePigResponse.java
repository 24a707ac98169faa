package ru.oparin.imagepig.model.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;
import ru.oparin.imagepig.service.ImageDownloader;
import ru.oparin.imagepig.service.ImagePigConstants;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Optional;

import static ru.oparin.imagepig.service.ImagePigConstants.Fields.*;

/**
 * Ответ ImagePig API.
 * <p>
 * Хранит разобранное JSON тело как есть. Поля читаются по запросу: при отсутствии поля
 * или несовпадении типа метод возвращает пустой {@link Optional}, а не ошибку.
 * Байты изображения получаются через {@link #data()}: из поля image_data
 * или загрузкой по image_url.
 */
@Slf4j
public class ImagePigResponse {

    /**
     * Разобранное JSON тело ответа.
     */
    @Getter
    private final JsonNode content;

    /**
     * HTTP статус ответа на запрос генерации.
     */
    @Getter
    private final int statusCode;

    private final ImageDownloader downloader;

    public ImagePigResponse(JsonNode content, int statusCode, ImageDownloader downloader) {
        this.content = content;
        this.statusCode = statusCode;
        this.downloader = downloader;
    }

    /**
     * Успешен ли HTTP статус ответа (2xx).
     */
    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * URL готового изображения (поле image_url).
     */
    public Optional<String> getUrl() {
        return textField(IMAGE_URL);
    }

    /**
     * Seed генерации (поле seed): беззнаковое 64-битное целое.
     */
    public Optional<BigInteger> getSeed() {
        JsonNode seed = content.get(SEED);
        if (seed == null || !seed.isIntegralNumber()) {
            return Optional.empty();
        }
        BigInteger value = seed.bigIntegerValue();
        if (value.signum() < 0 || value.bitLength() > Long.SIZE) {
            return Optional.empty();
        }
        return Optional.of(value);
    }

    /**
     * MIME тип изображения (поле mime_type).
     */
    public Optional<String> getMimeType() {
        return textField(MIME_TYPE);
    }

    /**
     * Длительность генерации: completed_at - started_at.
     * Может быть отрицательной, если сервер вернул такие метки времени.
     */
    public Optional<Duration> getDuration() {
        Optional<OffsetDateTime> startedAt = textField(STARTED_AT).flatMap(ImagePigResponse::parseTimestamp);
        Optional<OffsetDateTime> completedAt = textField(COMPLETED_AT).flatMap(ImagePigResponse::parseTimestamp);
        if (startedAt.isEmpty() || completedAt.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Duration.between(startedAt.get(), completedAt.get()));
    }

    /**
     * Получить байты изображения.
     * <ol>
     *   <li>Поле image_data: декодируется из base64 без сетевых запросов.</li>
     *   <li>Поле image_url: изображение загружается, при 404 с повторами.</li>
     *   <li>Иначе ошибка {@link ImagePigErrorType#MISSING_DATA}.</li>
     * </ol>
     *
     * @return байты изображения
     */
    public Mono<byte[]> data() {
        return Mono.defer(() -> {
            Optional<String> imageData = textField(IMAGE_DATA);
            if (imageData.isPresent()) {
                return decodeImageData(imageData.get());
            }

            Optional<String> url = getUrl();
            if (url.isPresent()) {
                return downloader.download(url.get());
            }

            log.warn("В ответе ImagePig API нет изображения, поля: {}", fieldNames());
            return Mono.error(new ImagePigException(ImagePigErrorType.MISSING_DATA,
                    ImagePigConstants.ErrorMessages.NO_IMAGE_IN_RESPONSE));
        });
    }

    /**
     * Сохранить изображение в файл. Файл создается или перезаписывается.
     *
     * @param path путь к файлу
     */
    public Mono<Void> save(Path path) {
        return data()
                .flatMap(bytes -> Mono.fromCallable(() -> write(path, bytes))
                        .subscribeOn(Schedulers.boundedElastic()))
                .doOnNext(written -> log.info("Изображение сохранено в {} ({} байт)", path, written))
                .then();
    }

    /**
     * Сохранить изображение в файл.
     *
     * @param path путь к файлу
     */
    public Mono<Void> save(String path) {
        return save(Path.of(path));
    }

    private static int write(Path path, byte[] bytes) {
        try {
            Files.write(path, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            return bytes.length;
        } catch (IOException e) {
            log.error("Ошибка при сохранении изображения в {}", path, e);
            throw new ImagePigException(ImagePigErrorType.UNEXPECTED_RESPONSE,
                    String.format(ImagePigConstants.ErrorMessages.SAVE_FAILED, path), e);
        }
    }

    private static Mono<byte[]> decodeImageData(String imageData) {
        try {
            return Mono.just(Base64.getDecoder().decode(imageData));
        } catch (IllegalArgumentException e) {
            return Mono.error(new ImagePigException(ImagePigErrorType.UNEXPECTED_RESPONSE,
                    ImagePigConstants.ErrorMessages.INVALID_IMAGE_DATA, e));
        }
    }

    private Optional<String> textField(String name) {
        JsonNode node = content.get(name);
        if (node == null || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.textValue());
    }

    private static Optional<OffsetDateTime> parseTimestamp(String value) {
        try {
            return Optional.of(OffsetDateTime.parse(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private String fieldNames() {
        StringBuilder names = new StringBuilder();
        content.fieldNames().forEachRemaining(name -> {
            if (names.length() > 0) {
                names.append(", ");
            }
            names.append(name);
        });
        return names.toString();
    }

    @Override
    public String toString() {
        return "ImagePigResponse{statusCode=" + statusCode + ", fields=[" + fieldNames() + "]}";
    }
}
