package ru.oparin.imagepig.config.properties;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import ru.oparin.imagepig.service.ImagePigConstants;

/**
 * Конфигурационные свойства клиента ImagePig.
 * Настройки загружаются из application.yml с префиксом imagepig.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "imagepig")
public class ImagePigProperties {

    /**
     * Настройки API ImagePig (URL и ключ авторизации).
     */
    private Api api = new Api();

    /**
     * Настройки HTTP соединения с API.
     */
    private Http http = new Http();

    /**
     * Настройки загрузки готовых изображений по URL.
     */
    private Download download = new Download();

    /**
     * Настройки пробного прогона всех эндпоинтов.
     */
    private Sample sample = new Sample();

    /**
     * Настройки API ImagePig.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Api {
        /**
         * Базовый URL API ImagePig.
         */
        private String url = ImagePigConstants.DEFAULT_API_URL;

        /**
         * API ключ для авторизации в ImagePig.
         */
        private String key;
    }

    /**
     * Настройки HTTP соединения.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Http {
        /**
         * Таймаут подключения в миллисекундах.
         */
        private int connectTimeoutMs = 30_000;

        /**
         * Таймаут ожидания ответа на запрос генерации в миллисекундах.
         */
        private long requestTimeoutMs = 300_000;
    }

    /**
     * Настройки загрузки изображения по URL из ответа.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Download {
        /**
         * Максимальное количество попыток загрузки.
         */
        private int attempts = ImagePigConstants.Download.ATTEMPTS;

        /**
         * Пауза между попытками при ответе 404 в миллисекундах.
         */
        private long interruptionMs = ImagePigConstants.Download.INTERRUPTION.toMillis();

        /**
         * Значение заголовка User-Agent.
         */
        private String userAgent = ImagePigConstants.Download.USER_AGENT;
    }

    /**
     * Настройки пробного прогона.
     */
    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Sample {
        /**
         * Запускать ли пробный прогон при старте приложения.
         */
        private boolean enabled;

        /**
         * Директория для сохранения результатов.
         */
        private String outputDir = "output";
    }
}
