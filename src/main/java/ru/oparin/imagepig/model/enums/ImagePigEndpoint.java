package ru.oparin.imagepig.model.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Эндпоинты ImagePig API.
 */
@Getter
@RequiredArgsConstructor
public enum ImagePigEndpoint {
    DEFAULT(""),
    XL("xl"),
    FLUX("flux"),
    FACESWAP("faceswap"),
    UPSCALE("upscale"),
    CUTOUT("cutout"),
    REPLACE("replace"),
    OUTPAINT("outpaint");

    /**
     * Путь относительно базового URL API.
     */
    private final String path;
}
