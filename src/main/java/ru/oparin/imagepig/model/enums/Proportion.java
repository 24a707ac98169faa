package ru.oparin.imagepig.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Пропорции изображения для генерации через Flux.
 */
@Getter
@RequiredArgsConstructor
public enum Proportion {
    /**
     * Альбомная ориентация (по умолчанию).
     */
    LANDSCAPE("landscape"),

    /**
     * Портретная ориентация.
     */
    PORTRAIT("portrait"),

    /**
     * Квадрат.
     */
    SQUARE("square"),

    /**
     * Широкий формат.
     */
    WIDE("wide");

    /**
     * Значение параметра proportion в запросе к API.
     */
    private final String value;
}
