package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;

import java.util.Map;

/**
 * Запрос замены лица: лицо с исходного изображения переносится на целевое.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FaceswapRq {

    @NotNull(message = "Исходное изображение обязательно")
    private ImageInput sourceImage;

    @NotNull(message = "Целевое изображение обязательно")
    private ImageInput targetImage;

    private Map<String, Object> extraParams;
}
