package ru.oparin.imagepig.mapper;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.RequiredArgsConstructor;
import ru.oparin.imagepig.model.ImageInput;
import ru.oparin.imagepig.model.dto.request.CutoutRq;
import ru.oparin.imagepig.model.dto.request.FaceswapRq;
import ru.oparin.imagepig.model.dto.request.FluxRq;
import ru.oparin.imagepig.model.dto.request.OutpaintRq;
import ru.oparin.imagepig.model.dto.request.ReplaceRq;
import ru.oparin.imagepig.model.dto.request.TextToImageRq;
import ru.oparin.imagepig.model.dto.request.UpscaleRq;
import ru.oparin.imagepig.model.enums.Proportion;
import ru.oparin.imagepig.model.enums.UpscalingFactor;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static ru.oparin.imagepig.service.ImagePigConstants.Params.*;

/**
 * Маппер запросов в параметры ImagePig API.
 * <p>
 * Порядок заполнения: сначала дополнительные параметры (extraParams), затем параметры,
 * которыми управляет маппер. При совпадении ключей побеждает маппер, поэтому extraParams
 * не могут подменить промпт, изображение или значения перечислений.
 * <p>
 * Все проверки выполняются до отправки запроса.
 */
@RequiredArgsConstructor
public class ImagePigRequestMapper {

    private final Validator validator;

    /**
     * Создать маппер с валидатором по умолчанию.
     */
    public static ImagePigRequestMapper withDefaultValidator() {
        return new ImagePigRequestMapper(defaultValidator());
    }

    /**
     * Валидатор Bean Validation по умолчанию.
     */
    public static Validator defaultValidator() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        return factory.getValidator();
    }

    public Map<String, Object> toParams(TextToImageRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        params.put(POSITIVE_PROMPT, rq.getPositivePrompt());
        params.put(NEGATIVE_PROMPT, orEmpty(rq.getNegativePrompt()));
        return params;
    }

    public Map<String, Object> toParams(FluxRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        params.put(POSITIVE_PROMPT, rq.getPositivePrompt());
        params.put(NEGATIVE_PROMPT, orEmpty(rq.getNegativePrompt()));
        Proportion proportion = rq.getProportion() != null ? rq.getProportion() : Proportion.LANDSCAPE;
        params.put(PROPORTION, proportion.getValue());
        return params;
    }

    public Map<String, Object> toParams(FaceswapRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        prepareImage(rq.getSourceImage(), SOURCE_IMAGE, params);
        prepareImage(rq.getTargetImage(), TARGET_IMAGE, params);
        return params;
    }

    public Map<String, Object> toParams(UpscaleRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        prepareImage(rq.getImage(), IMAGE, params);
        UpscalingFactor factor = rq.getUpscalingFactor() != null ? rq.getUpscalingFactor() : UpscalingFactor.TWO;
        params.put(UPSCALING_FACTOR, factor.getValue());
        return params;
    }

    public Map<String, Object> toParams(CutoutRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        prepareImage(rq.getImage(), IMAGE, params);
        return params;
    }

    public Map<String, Object> toParams(ReplaceRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        prepareImage(rq.getImage(), IMAGE, params);
        params.put(SELECT_PROMPT, rq.getSelectPrompt());
        params.put(POSITIVE_PROMPT, rq.getPositivePrompt());
        params.put(NEGATIVE_PROMPT, orEmpty(rq.getNegativePrompt()));
        return params;
    }

    public Map<String, Object> toParams(OutpaintRq rq) {
        validate(rq);
        Map<String, Object> params = initParams(rq.getExtraParams());
        prepareImage(rq.getImage(), IMAGE, params);
        params.put(POSITIVE_PROMPT, rq.getPositivePrompt());
        params.put(NEGATIVE_PROMPT, orEmpty(rq.getNegativePrompt()));
        params.put(TOP, orZero(rq.getTop()));
        params.put(RIGHT, orZero(rq.getRight()));
        params.put(BOTTOM, orZero(rq.getBottom()));
        params.put(LEFT, orZero(rq.getLeft()));
        return params;
    }

    /**
     * Записать изображение в параметры. Ключи противоположного варианта
     * ({@code _url} / {@code _data}) удаляются, чтобы extraParams не оставили оба сразу.
     */
    private void prepareImage(ImageInput image, String field, Map<String, Object> params) {
        params.remove(field + URL_SUFFIX);
        params.remove(field + DATA_SUFFIX);
        image.prepare(field, params);
    }

    private Map<String, Object> initParams(Map<String, Object> extraParams) {
        return extraParams != null ? new HashMap<>(extraParams) : new HashMap<>();
    }

    private <T> void validate(T rq) {
        if (rq == null) {
            throw new IllegalArgumentException("Запрос не может быть null");
        }
        Set<ConstraintViolation<T>> violations = validator.validate(rq);
        if (!violations.isEmpty()) {
            throw new ConstraintViolationException(violations);
        }
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
