package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Запрос генерации изображения по текстовому описанию (модели default и XL).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextToImageRq {

    /** Описание изображения (промпт) */
    @NotBlank(message = "Промпт не может быть пустым")
    private String positivePrompt;

    /** Что не должно попасть на изображение. Если не указано, отправляется пустая строка */
    private String negativePrompt;

    /** Дополнительные параметры API. Не переопределяют основные параметры запроса */
    private Map<String, Object> extraParams;
}
