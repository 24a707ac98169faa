package ru.oparin.imagepig.service;

import java.time.Duration;

/**
 * Константы клиента ImagePig.
 */
public final class ImagePigConstants {

    private ImagePigConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Базовый URL ImagePig API по умолчанию.
     */
    public static final String DEFAULT_API_URL = "https://api.imagepig.com";

    /**
     * Заголовок с API ключом.
     */
    public static final String API_KEY_HEADER = "Api-Key";

    /**
     * Константы для загрузки готового изображения по URL.
     */
    public static final class Download {
        private Download() {
            throw new UnsupportedOperationException("Utility class");
        }

        /**
         * Максимальное количество попыток загрузки.
         */
        public static final int ATTEMPTS = 10;

        /**
         * Пауза между попытками, пока файл еще не доступен (404).
         */
        public static final Duration INTERRUPTION = Duration.ofSeconds(1);

        /**
         * User-Agent для загрузки: некоторые хранилища отклоняют запросы без него.
         */
        public static final String USER_AGENT = "Mozilla/5.0";
    }

    /**
     * Имена параметров запроса к API.
     */
    public static final class Params {
        private Params() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String POSITIVE_PROMPT = "positive_prompt";
        public static final String NEGATIVE_PROMPT = "negative_prompt";
        public static final String SELECT_PROMPT = "select_prompt";
        public static final String PROPORTION = "proportion";
        public static final String UPSCALING_FACTOR = "upscaling_factor";
        public static final String TOP = "top";
        public static final String RIGHT = "right";
        public static final String BOTTOM = "bottom";
        public static final String LEFT = "left";

        public static final String IMAGE = "image";
        public static final String SOURCE_IMAGE = "source_image";
        public static final String TARGET_IMAGE = "target_image";

        public static final String URL_SUFFIX = "_url";
        public static final String DATA_SUFFIX = "_data";
    }

    /**
     * Поля ответа API.
     */
    public static final class Fields {
        private Fields() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String IMAGE_DATA = "image_data";
        public static final String IMAGE_URL = "image_url";
        public static final String SEED = "seed";
        public static final String MIME_TYPE = "mime_type";
        public static final String STARTED_AT = "started_at";
        public static final String COMPLETED_AT = "completed_at";
    }

    /**
     * Сообщения об ошибках.
     */
    public static final class ErrorMessages {
        private ErrorMessages() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String CONNECTION_ERROR = "Не удалось выполнить запрос к ImagePig API: %s";
        public static final String BODY_READ_FAILED = "Не удалось прочитать ответ ImagePig API: %s";
        public static final String EMPTY_RESPONSE = "Пустой ответ от ImagePig API";
        public static final String INVALID_JSON = "Ответ ImagePig API не является корректным JSON";
        public static final String INVALID_IMAGE_DATA = "Поле image_data содержит некорректный base64";
        public static final String NO_IMAGE_IN_RESPONSE = "В ответе нет ни image_data, ни image_url";
        public static final String DOWNLOAD_FAILED = "Не удалось загрузить изображение по URL %s";
        public static final String SAVE_FAILED = "Не удалось сохранить изображение в %s";
    }
}
