package ru.oparin.imagepig.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Коэффициент увеличения изображения.
 */
@Getter
@RequiredArgsConstructor
public enum UpscalingFactor {
    /**
     * Увеличение в 2 раза (по умолчанию).
     */
    TWO(2),

    /**
     * Увеличение в 4 раза.
     */
    FOUR(4),

    /**
     * Увеличение в 8 раз.
     */
    EIGHT(8);

    /**
     * Значение параметра upscaling_factor в запросе к API.
     */
    private final int value;
}
