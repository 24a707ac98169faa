package ru.oparin.imagepig.model;

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.exception.InvalidImageUrlException;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;
import ru.oparin.imagepig.service.ImagePigConstants;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Входное изображение для запроса: ссылка на удаленный файл или содержимое в base64.
 * <p>
 * Других вариантов нет: конструктор закрыт, экземпляры создаются только через
 * {@link #url(String)} и {@link #base64(byte[])}. Каждый вариант сам записывает
 * в параметры запроса ровно один ключ: {@code <поле>_url} или {@code <поле>_data}.
 */
public abstract class ImageInput {

    private ImageInput() {
    }

    /**
     * Изображение, доступное по URL.
     *
     * @param url абсолютный URL изображения
     */
    public static ImageInput url(String url) {
        return new RemoteReference(url);
    }

    /**
     * Изображение, переданное содержимым.
     *
     * @param base64 base64 представление файла изображения
     */
    public static ImageInput base64(byte[] base64) {
        return new InlineBytes(base64);
    }

    /**
     * Изображение, переданное содержимым в виде base64 строки.
     */
    public static ImageInput base64(String base64) {
        return new InlineBytes(base64 != null ? base64.getBytes(StandardCharsets.US_ASCII) : null);
    }

    /**
     * Записать изображение в параметры запроса.
     *
     * @param field  имя поля изображения (image, source_image, target_image)
     * @param params параметры запроса
     * @throws InvalidImageUrlException если URL некорректен
     * @throws ImagePigException        если base64 не удалось декодировать
     */
    public abstract void prepare(String field, Map<String, Object> params);

    /**
     * Ссылка на изображение.
     */
    public static final class RemoteReference extends ImageInput {

        private final String url;

        private RemoteReference(String url) {
            this.url = url;
        }

        public String getUrl() {
            return url;
        }

        @Override
        public void prepare(String field, Map<String, Object> params) {
            if (!isAbsoluteUrl(url)) {
                throw new InvalidImageUrlException(url);
            }
            params.put(field + ImagePigConstants.Params.URL_SUFFIX, url);
        }

        /**
         * URL должен содержать схему. Недопустимые в URI символы пути и запроса
         * (например, пробелы) допускаются и кодируются при проверке, пробелы в имени хоста - нет.
         */
        private static boolean isAbsoluteUrl(String value) {
            if (value == null || value.isBlank()) {
                return false;
            }
            try {
                UriComponents components = UriComponentsBuilder.fromUriString(value.strip()).build();
                if (components.getScheme() == null) {
                    return false;
                }
                String host = components.getHost();
                if (host != null && host.chars().anyMatch(Character::isWhitespace)) {
                    return false;
                }
                return components.encode().toUri().isAbsolute();
            } catch (IllegalArgumentException | IllegalStateException e) {
                return false;
            }
        }

        @Override
        public String toString() {
            return "RemoteReference{" + url + "}";
        }
    }

    /**
     * Содержимое изображения в base64.
     */
    public static final class InlineBytes extends ImageInput {

        private final byte[] base64;

        private InlineBytes(byte[] base64) {
            this.base64 = base64;
        }

        @Override
        public void prepare(String field, Map<String, Object> params) {
            if (base64 == null) {
                throw new ImagePigException(ImagePigErrorType.INVALID_INPUT);
            }
            try {
                params.put(field + ImagePigConstants.Params.DATA_SUFFIX, Base64.getDecoder().decode(base64));
            } catch (IllegalArgumentException e) {
                throw new ImagePigException(ImagePigErrorType.INVALID_INPUT,
                        ImagePigErrorType.INVALID_INPUT.getDefaultMessage(), e);
            }
        }

        // Содержимое не выводим: base64 может занимать мегабайты
        @Override
        public String toString() {
            return "InlineBytes{" + (base64 != null ? base64.length : 0) + " bytes}";
        }
    }
}
