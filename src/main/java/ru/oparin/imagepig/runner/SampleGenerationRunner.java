package ru.oparin.imagepig.runner;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.model.ImageInput;
import ru.oparin.imagepig.model.dto.ImagePigResponse;
import ru.oparin.imagepig.model.dto.request.OutpaintRq;
import ru.oparin.imagepig.service.ImagePigClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Пробный прогон всех эндпоинтов ImagePig API.
 * Результаты сохраняются в директорию imagepig.sample.output-dir.
 * Ошибка одного шага логируется, остальные шаги продолжают выполняться.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "imagepig.sample", name = "enabled", havingValue = "true")
public class SampleGenerationRunner implements CommandLineRunner {

    static final String JANE = "https://imagepig.com/static/jane.jpeg";
    static final String MONA_LISA = "https://imagepig.com/static/mona-lisa.jpeg";
    private static final String PROMPT = "pig";

    private final ImagePigClient imagePigClient;
    private final ImagePigProperties properties;

    @Override
    public void run(String... args) throws IOException {
        Path outputDir = Path.of(properties.getSample().getOutputDir());
        Files.createDirectories(outputDir);

        long failed = runAll(outputDir).block();
        log.info("Пробный прогон завершен, ошибок: {}", failed);
    }

    /**
     * Выполнить все шаги последовательно.
     *
     * @return количество неудачных шагов
     */
    Mono<Long> runAll(Path outputDir) {
        return Flux.fromIterable(steps().entrySet())
                .concatMap(step -> runStep(outputDir.resolve(step.getKey()), step.getValue()))
                .filter(success -> !success)
                .count();
    }

    private Mono<Boolean> runStep(Path target, Supplier<Mono<ImagePigResponse>> call) {
        return Mono.defer(call)
                .doOnNext(response -> log.info("Ответ для {}: seed={}, mimeType={}, длительность={}",
                        target.getFileName(), response.getSeed().orElse(null),
                        response.getMimeType().orElse(null), response.getDuration().orElse(null)))
                .flatMap(response -> response.save(target))
                .thenReturn(true)
                .onErrorResume(e -> {
                    log.error("Шаг {} завершился ошибкой: {}", target.getFileName(), e.getMessage(), e);
                    return Mono.just(false);
                });
    }

    private Map<String, Supplier<Mono<ImagePigResponse>>> steps() {
        ImageInput jane = ImageInput.url(JANE);
        ImageInput monaLisa = ImageInput.url(MONA_LISA);

        Map<String, Supplier<Mono<ImagePigResponse>>> steps = new LinkedHashMap<>();
        steps.put("pig1.jpeg", () -> imagePigClient.generate(PROMPT));
        steps.put("pig2.jpeg", () -> imagePigClient.xl(PROMPT));
        steps.put("pig3.jpeg", () -> imagePigClient.flux(PROMPT));
        steps.put("faceswap.jpeg", () -> imagePigClient.faceswap(jane, monaLisa));
        steps.put("upscale.jpeg", () -> imagePigClient.upscale(jane));
        steps.put("cutout.png", () -> imagePigClient.cutout(jane));
        steps.put("replace.jpeg", () -> imagePigClient.replace(jane, "woman", "robot"));
        steps.put("outpaint.jpeg", () -> imagePigClient.outpaint(OutpaintRq.builder()
                .image(jane)
                .positivePrompt("dress")
                .right(500)
                .build()));
        return steps;
    }
}
