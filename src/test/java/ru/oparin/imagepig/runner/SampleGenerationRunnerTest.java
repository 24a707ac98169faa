package ru.oparin.imagepig.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.model.ImageInput;
import ru.oparin.imagepig.model.dto.ImagePigResponse;
import ru.oparin.imagepig.model.dto.request.OutpaintRq;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;
import ru.oparin.imagepig.service.ImagePigClient;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SampleGenerationRunnerTest {

    @TempDir
    Path tempDir;

    private ImagePigClient client;
    private SampleGenerationRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        client = mock(ImagePigClient.class);
        ImagePigProperties properties = new ImagePigProperties();
        properties.getSample().setOutputDir(tempDir.resolve("output").toString());
        runner = new SampleGenerationRunner(client, properties);

        ImagePigResponse hello = new ImagePigResponse(
                new ObjectMapper().readTree("{\"image_data\": \"aGVsbG8=\"}"), 200, null);
        when(client.generate(anyString())).thenReturn(Mono.just(hello));
        when(client.xl(anyString())).thenReturn(Mono.just(hello));
        when(client.flux(anyString())).thenReturn(Mono.just(hello));
        when(client.faceswap(any(ImageInput.class), any(ImageInput.class))).thenReturn(Mono.just(hello));
        when(client.upscale(any(ImageInput.class))).thenReturn(Mono.just(hello));
        when(client.cutout(any(ImageInput.class)))
                .thenReturn(Mono.error(new ImagePigException(ImagePigErrorType.HTTP_ERROR)));
        when(client.replace(any(ImageInput.class), anyString(), anyString())).thenReturn(Mono.just(hello));
        when(client.outpaint(any(OutpaintRq.class))).thenReturn(Mono.just(hello));
    }

    @Test
    void savesEveryStepAndContinuesAfterFailure() throws Exception {
        runner.run();

        Path output = tempDir.resolve("output");
        for (String name : new String[]{"pig1.jpeg", "pig2.jpeg", "pig3.jpeg", "faceswap.jpeg",
                "upscale.jpeg", "replace.jpeg", "outpaint.jpeg"}) {
            assertArrayEquals("hello".getBytes(), Files.readAllBytes(output.resolve(name)), name);
        }
        assertFalse(Files.exists(output.resolve("cutout.png")));
    }

    @Test
    void countsFailedSteps() throws Exception {
        Files.createDirectories(tempDir.resolve("output"));

        assertEquals(1L, runner.runAll(tempDir.resolve("output")).block());
    }

    @Test
    void outpaintExtendsRightSide() throws Exception {
        runner.run();

        ArgumentCaptor<OutpaintRq> captor = ArgumentCaptor.forClass(OutpaintRq.class);
        verify(client).outpaint(captor.capture());
        assertEquals("dress", captor.getValue().getPositivePrompt());
        assertEquals(500, captor.getValue().getRight());
        assertNull(captor.getValue().getTop());
        verify(client).replace(any(ImageInput.class), eq("woman"), eq("robot"));
    }
}
