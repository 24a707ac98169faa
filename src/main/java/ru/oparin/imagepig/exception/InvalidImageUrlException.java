package ru.oparin.imagepig.exception;

import lombok.Getter;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;

/**
 * Ссылка на входное изображение не является корректным абсолютным URL.
 */
@Getter
public class InvalidImageUrlException extends ImagePigException {

    /**
     * Переданная строка, которую не удалось разобрать как URL.
     */
    private final String url;

    public InvalidImageUrlException(String url) {
        super(ImagePigErrorType.INVALID_URL, ImagePigErrorType.INVALID_URL.getDefaultMessage() + ": " + url);
        this.url = url;
    }
}
