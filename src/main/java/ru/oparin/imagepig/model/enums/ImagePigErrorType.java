package ru.oparin.imagepig.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Типы ошибок клиента ImagePig.
 */
@Getter
@RequiredArgsConstructor
public enum ImagePigErrorType {
    /**
     * Ошибка транспорта: подключение, таймаут, TLS.
     */
    HTTP_ERROR("Ошибка HTTP запроса"),

    /**
     * Переданная ссылка на изображение не является абсолютным URL.
     */
    INVALID_URL("Некорректный URL"),

    /**
     * Переданные байты изображения не являются корректным base64.
     */
    INVALID_INPUT("Не удалось декодировать изображение из base64"),

    /**
     * Ответ не удалось разобрать или сохранить.
     */
    UNEXPECTED_RESPONSE("Неожиданный ответ"),

    /**
     * Не удалось получить байты изображения из ответа.
     */
    MISSING_DATA("Не удалось получить изображение");

    private final String defaultMessage;
}
