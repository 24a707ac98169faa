package ru.oparin.imagepig.model.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;

import java.util.Map;

/**
 * Запрос удаления фона.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CutoutRq {

    @NotNull(message = "Изображение обязательно")
    private ImageInput image;

    private Map<String, Object> extraParams;
}
