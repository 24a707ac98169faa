package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.enums.Proportion;

import java.util.Map;

/**
 * Запрос генерации изображения моделью Flux.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FluxRq {

    /** Описание изображения (промпт) */
    @NotBlank(message = "Промпт не может быть пустым")
    private String positivePrompt;

    /** Что не должно быть на изображении. По умолчанию пустая строка */
    private String negativePrompt;

    /** Пропорции изображения. По умолчанию: LANDSCAPE */
    private Proportion proportion;

    /** Дополнительные параметры API */
    private Map<String, Object> extraParams;
}
