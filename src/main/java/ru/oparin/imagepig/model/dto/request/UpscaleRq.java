package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;
import ru.oparin.imagepig.model.enums.UpscalingFactor;

import java.util.Map;

/**
 * Запрос увеличения разрешения изображения.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpscaleRq {

    @NotNull(message = "Изображение обязательно")
    private ImageInput image;

    /** Коэффициент увеличения. По умолчанию: TWO */
    private UpscalingFactor upscalingFactor;

    private Map<String, Object> extraParams;
}
