package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;

import java.util.Map;

/**
 * Запрос замены объекта на изображении по текстовому описанию.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplaceRq {

    @NotNull(message = "Изображение обязательно")
    private ImageInput image;

    /** Что заменить (например, "woman") */
    @NotBlank(message = "Описание заменяемого объекта не может быть пустым")
    private String selectPrompt;

    /** На что заменить (например, "robot") */
    @NotBlank(message = "Промпт не может быть пустым")
    private String positivePrompt;

    private String negativePrompt;

    private Map<String, Object> extraParams;
}
