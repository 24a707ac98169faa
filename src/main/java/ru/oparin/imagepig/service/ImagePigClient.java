package ru.oparin.imagepig.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import ru.oparin.imagepig.config.ImagePigConfig;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.mapper.ImagePigRequestMapper;
import ru.oparin.imagepig.model.ImageInput;
import ru.oparin.imagepig.model.dto.ImagePigResponse;
import ru.oparin.imagepig.model.dto.request.CutoutRq;
import ru.oparin.imagepig.model.dto.request.FaceswapRq;
import ru.oparin.imagepig.model.dto.request.FluxRq;
import ru.oparin.imagepig.model.dto.request.OutpaintRq;
import ru.oparin.imagepig.model.dto.request.ReplaceRq;
import ru.oparin.imagepig.model.dto.request.TextToImageRq;
import ru.oparin.imagepig.model.dto.request.UpscaleRq;
import ru.oparin.imagepig.model.enums.ImagePigEndpoint;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;

import java.time.Duration;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Клиент ImagePig API.
 * <p>
 * Каждая операция строит параметры запроса, выполняет один POST запрос
 * на {@code {api.url}/{endpoint}} с заголовком Api-Key и возвращает {@link ImagePigResponse}.
 * Ошибки построения запроса (некорректный URL или base64) возникают до отправки запроса.
 * <p>
 * Клиент не хранит изменяемого состояния и может использоваться из нескольких потоков.
 */
@Slf4j
public class ImagePigClient {

    private final WebClient webClient;
    private final ImagePigRequestMapper requestMapper;
    private final ImageDownloader downloader;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final Duration requestTimeout;

    public ImagePigClient(ImagePigProperties properties, WebClient.Builder webClientBuilder,
                          ObjectMapper objectMapper, ImagePigRequestMapper requestMapper) {
        String apiUrl = properties.getApi().getUrl();
        if (apiUrl == null || apiUrl.isBlank()) {
            apiUrl = ImagePigConstants.DEFAULT_API_URL;
        }
        this.apiKey = properties.getApi().getKey();
        if (!StringUtils.hasText(apiKey)) {
            log.warn("ImagePig API ключ не настроен, заголовок {} не будет отправляться",
                    ImagePigConstants.API_KEY_HEADER);
        }

        this.webClient = webClientBuilder.clone()
                .baseUrl(apiUrl)
                .build();
        this.downloader = new ImageDownloader(webClientBuilder, properties.getDownload());
        this.objectMapper = objectMapper;
        this.requestMapper = requestMapper;
        this.requestTimeout = Duration.ofMillis(properties.getHttp().getRequestTimeoutMs());
        log.info("ImagePig клиент настроен, api.url={}", apiUrl);
    }

    /**
     * Создать клиент без Spring контекста с URL API по умолчанию.
     *
     * @param apiKey API ключ
     */
    public static ImagePigClient create(String apiKey) {
        return create(apiKey, null);
    }

    /**
     * Создать клиент без Spring контекста.
     *
     * @param apiKey API ключ
     * @param apiUrl базовый URL API, null для URL по умолчанию
     */
    public static ImagePigClient create(String apiKey, String apiUrl) {
        ImagePigProperties properties = new ImagePigProperties();
        properties.getApi().setKey(apiKey);
        if (apiUrl != null) {
            properties.getApi().setUrl(apiUrl);
        }
        return new ImagePigClient(
                properties,
                ImagePigConfig.configureWebClient(WebClient.builder(), properties),
                new ObjectMapper(),
                ImagePigRequestMapper.withDefaultValidator());
    }

    /**
     * Генерация изображения моделью по умолчанию.
     */
    public Mono<ImagePigResponse> generate(TextToImageRq rq) {
        return execute(ImagePigEndpoint.DEFAULT, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> generate(String prompt) {
        return generate(TextToImageRq.builder().positivePrompt(prompt).build());
    }

    /**
     * Генерация изображения моделью XL.
     */
    public Mono<ImagePigResponse> xl(TextToImageRq rq) {
        return execute(ImagePigEndpoint.XL, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> xl(String prompt) {
        return xl(TextToImageRq.builder().positivePrompt(prompt).build());
    }

    /**
     * Генерация изображения моделью Flux.
     */
    public Mono<ImagePigResponse> flux(FluxRq rq) {
        return execute(ImagePigEndpoint.FLUX, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> flux(String prompt) {
        return flux(FluxRq.builder().positivePrompt(prompt).build());
    }

    /**
     * Перенос лица с исходного изображения на целевое.
     */
    public Mono<ImagePigResponse> faceswap(FaceswapRq rq) {
        return execute(ImagePigEndpoint.FACESWAP, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> faceswap(ImageInput sourceImage, ImageInput targetImage) {
        return faceswap(FaceswapRq.builder().sourceImage(sourceImage).targetImage(targetImage).build());
    }

    /**
     * Увеличение разрешения изображения.
     */
    public Mono<ImagePigResponse> upscale(UpscaleRq rq) {
        return execute(ImagePigEndpoint.UPSCALE, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> upscale(ImageInput image) {
        return upscale(UpscaleRq.builder().image(image).build());
    }

    /**
     * Удаление фона.
     */
    public Mono<ImagePigResponse> cutout(CutoutRq rq) {
        return execute(ImagePigEndpoint.CUTOUT, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> cutout(ImageInput image) {
        return cutout(CutoutRq.builder().image(image).build());
    }

    /**
     * Замена объекта на изображении.
     */
    public Mono<ImagePigResponse> replace(ReplaceRq rq) {
        return execute(ImagePigEndpoint.REPLACE, () -> requestMapper.toParams(rq));
    }

    public Mono<ImagePigResponse> replace(ImageInput image, String selectPrompt, String positivePrompt) {
        return replace(ReplaceRq.builder()
                .image(image)
                .selectPrompt(selectPrompt)
                .positivePrompt(positivePrompt)
                .build());
    }

    /**
     * Дорисовка изображения за его границами.
     */
    public Mono<ImagePigResponse> outpaint(OutpaintRq rq) {
        return execute(ImagePigEndpoint.OUTPAINT, () -> requestMapper.toParams(rq));
    }

    /**
     * Построить параметры и выполнить запрос. Если параметры построить не удалось,
     * запрос не отправляется.
     */
    private Mono<ImagePigResponse> execute(ImagePigEndpoint endpoint, Supplier<Map<String, Object>> params) {
        return Mono.fromSupplier(params)
                .flatMap(built -> call(endpoint, built));
    }

    /**
     * Выполнить POST запрос к API.
     *
     * @param endpoint эндпоинт API
     * @param params   параметры запроса (JSON тело)
     * @return ответ API независимо от HTTP статуса
     */
    public Mono<ImagePigResponse> call(ImagePigEndpoint endpoint, Map<String, Object> params) {
        log.info("Запрос в ImagePig API: endpoint=/{}, параметры: {}", endpoint.getPath(), describe(params));

        return webClient.post()
                .uri("/" + endpoint.getPath())
                .headers(headers -> {
                    if (StringUtils.hasText(apiKey)) {
                        headers.set(ImagePigConstants.API_KEY_HEADER, apiKey);
                    }
                })
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(params)
                .exchangeToMono(response -> readResponse(endpoint, response))
                .timeout(requestTimeout)
                .onErrorMap(this::isTransportError, e -> {
                    log.error("Ошибка при запросе к ImagePig API, endpoint=/{}: {}", endpoint.getPath(), e.getMessage());
                    return new ImagePigException(ImagePigErrorType.HTTP_ERROR,
                            String.format(ImagePigConstants.ErrorMessages.CONNECTION_ERROR, e.getMessage()), e);
                });
    }

    /**
     * Разобрать тело ответа как JSON. HTTP статус не проверяется: тело ошибки
     * тоже возвращается в {@link ImagePigResponse}.
     */
    private Mono<ImagePigResponse> readResponse(ImagePigEndpoint endpoint, ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().isError()) {
            log.warn("ImagePig API вернул статус {} для endpoint=/{}", statusCode, endpoint.getPath());
        }
        return response.bodyToMono(String.class)
                .onErrorMap(e -> !(e instanceof ImagePigException), e -> {
                    log.error("Ошибка при чтении ответа от ImagePig API, endpoint=/{}, статус {}: {}",
                            endpoint.getPath(), statusCode, e.getMessage());
                    return new ImagePigException(ImagePigErrorType.UNEXPECTED_RESPONSE,
                            String.format(ImagePigConstants.ErrorMessages.BODY_READ_FAILED, e.getMessage()), e);
                })
                .defaultIfEmpty("")
                .flatMap(body -> {
                    if (body.isBlank()) {
                        log.error("Пустой ответ от ImagePig API, endpoint=/{}, статус {}", endpoint.getPath(), statusCode);
                        return Mono.error(new ImagePigException(ImagePigErrorType.UNEXPECTED_RESPONSE,
                                ImagePigConstants.ErrorMessages.EMPTY_RESPONSE));
                    }
                    try {
                        JsonNode content = objectMapper.readTree(body);
                        log.debug("Ответ от ImagePig API, endpoint=/{}, статус {}", endpoint.getPath(), statusCode);
                        return Mono.just(new ImagePigResponse(content, statusCode, downloader));
                    } catch (JsonProcessingException e) {
                        log.error("Ошибка при парсинге ответа от ImagePig API, endpoint=/{}, статус {}",
                                endpoint.getPath(), statusCode, e);
                        return Mono.error(new ImagePigException(ImagePigErrorType.UNEXPECTED_RESPONSE,
                                ImagePigConstants.ErrorMessages.INVALID_JSON, e));
                    }
                });
    }

    private boolean isTransportError(Throwable error) {
        return error instanceof WebClientRequestException || error instanceof TimeoutException;
    }

    /**
     * Описание параметров для лога: байты изображений заменены размером.
     */
    private static Map<String, Object> describe(Map<String, Object> params) {
        Map<String, Object> loggable = new TreeMap<>();
        params.forEach((key, value) -> {
            if (value instanceof byte[] bytes) {
                loggable.put(key, String.format("[%d bytes]", bytes.length));
            } else {
                loggable.put(key, value);
            }
        });
        return loggable;
    }
}
