package ru.oparin.imagepig.exception;

import lombok.Getter;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;

/**
 * Ошибка при работе с ImagePig API.
 * Тип ошибки определяет, на каком этапе она произошла.
 */
@Getter
public class ImagePigException extends RuntimeException {

    private final ImagePigErrorType errorType;

    public ImagePigException(ImagePigErrorType errorType) {
        super(errorType.getDefaultMessage());
        this.errorType = errorType;
    }

    public ImagePigException(ImagePigErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ImagePigException(ImagePigErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }
}
