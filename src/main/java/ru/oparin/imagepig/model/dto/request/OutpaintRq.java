package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;

import java.util.Map;

/**
 * Запрос дорисовки изображения за его границами.
 * Отступы задаются в пикселях, не указанные считаются равными 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutpaintRq {

    @NotNull(message = "Изображение обязательно")
    private ImageInput image;

    @NotBlank(message = "Промпт не может быть пустым")
    private String positivePrompt;

    private String negativePrompt;

    @PositiveOrZero(message = "Отступ не может быть отрицательным")
    private Integer top;

    @PositiveOrZero(message = "Отступ не может быть отрицательным")
    private Integer right;

    @PositiveOrZero(message = "Отступ не может быть отрицательным")
    private Integer bottom;

    @PositiveOrZero(message = "Отступ не может быть отрицательным")
    private Integer left;

    private Map<String, Object> extraParams;
}
