package ru.oparin.imagepig.service;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

/**
 * Результат одной попытки загрузки изображения по URL.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class DownloadAttempt {

    /**
     * Исход попытки.
     */
    public enum Outcome {
        /**
         * Изображение получено (2xx).
         */
        SUCCESS,

        /**
         * Файл еще не доступен в хранилище (404), попытку можно повторить.
         */
        RETRYABLE,

        /**
         * Другой статус или ошибка транспорта, загрузка прекращается.
         */
        FATAL
    }

    private final Outcome outcome;

    /**
     * Байты изображения, только для {@link Outcome#SUCCESS}.
     */
    private final byte[] data;

    /**
     * HTTP статус ответа, null при ошибке транспорта.
     */
    private final Integer statusCode;

    public static DownloadAttempt success(byte[] data, int statusCode) {
        return new DownloadAttempt(Outcome.SUCCESS, data, statusCode);
    }

    public static DownloadAttempt retryable(int statusCode) {
        return new DownloadAttempt(Outcome.RETRYABLE, null, statusCode);
    }

    public static DownloadAttempt fatal(int statusCode) {
        return new DownloadAttempt(Outcome.FATAL, null, statusCode);
    }

    public static DownloadAttempt transportFailure() {
        return new DownloadAttempt(Outcome.FATAL, null, null);
    }

    /**
     * Определить исход попытки по HTTP статусу.
     *
     * @param status статус ответа
     * @return SUCCESS для 2xx, RETRYABLE для 404, FATAL для остальных
     */
    public static Outcome classify(HttpStatusCode status) {
        if (status.is2xxSuccessful()) {
            return Outcome.SUCCESS;
        }
        if (status.value() == HttpStatus.NOT_FOUND.value()) {
            return Outcome.RETRYABLE;
        }
        return Outcome.FATAL;
    }
}
