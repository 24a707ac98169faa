package ru.oparin.imagepig.model.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;
import ru.oparin.imagepig.service.ImageDownloader;
import ru.oparin.imagepig.support.ScriptedExchangeFunction;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ImagePigResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScriptedExchangeFunction transport = new ScriptedExchangeFunction();

    @TempDir
    Path tempDir;

    private ImagePigResponse response(String json) throws Exception {
        ImagePigProperties.Download download = new ImagePigProperties.Download();
        download.setInterruptionMs(0);
        ImageDownloader downloader = new ImageDownloader(transport.webClientBuilder(), download);
        return new ImagePigResponse(objectMapper.readTree(json), 200, downloader);
    }

    @Test
    void inlineDataIsDecodedWithoutRequests() throws Exception {
        StepVerifier.create(response("{\"image_data\": \"aGVsbG8=\"}").data())
                .assertNext(bytes -> assertArrayEquals("hello".getBytes(), bytes))
                .verifyComplete();

        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void inlineDataWinsOverUrl() throws Exception {
        StepVerifier.create(response("{\"image_data\": \"aGVsbG8=\", \"image_url\": \"http://x/y\"}").data())
                .assertNext(bytes -> assertArrayEquals("hello".getBytes(), bytes))
                .verifyComplete();

        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void invalidInlineDataIsUnexpectedResponse() throws Exception {
        StepVerifier.create(response("{\"image_data\": \"%%%\"}").data())
                .expectErrorSatisfies(e -> assertErrorType(e, ImagePigErrorType.UNEXPECTED_RESPONSE))
                .verify();
    }

    @Test
    void nonTextInlineDataFallsBackToUrl() throws Exception {
        transport.respond(HttpStatus.OK, "hello");

        StepVerifier.create(response("{\"image_data\": 5, \"image_url\": \"http://x/y\"}").data())
                .assertNext(bytes -> assertArrayEquals("hello".getBytes(), bytes))
                .verifyComplete();

        assertEquals(1, transport.getRequests().size());
    }

    @Test
    void urlIsDownloadedAfterNotFound() throws Exception {
        transport.respondTimes(3, HttpStatus.NOT_FOUND).respond(HttpStatus.OK, "hello");

        StepVerifier.create(response("{\"image_url\": \"http://x/y\"}").data())
                .assertNext(bytes -> assertArrayEquals("hello".getBytes(), bytes))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(4, transport.getRequests().size());
    }

    @Test
    void serverErrorOnDownloadIsMissingData() throws Exception {
        transport.respond(HttpStatus.INTERNAL_SERVER_ERROR);

        StepVerifier.create(response("{\"image_url\": \"http://x/y\"}").data())
                .expectErrorSatisfies(e -> assertErrorType(e, ImagePigErrorType.MISSING_DATA))
                .verify(Duration.ofSeconds(5));

        assertEquals(1, transport.getRequests().size());
    }

    @Test
    void emptyBodyIsMissingDataWithoutRequests() throws Exception {
        StepVerifier.create(response("{}").data())
                .expectErrorSatisfies(e -> assertErrorType(e, ImagePigErrorType.MISSING_DATA))
                .verify();

        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void accessorsReadTypedFields() throws Exception {
        ImagePigResponse response = response("{\"image_url\": \"http://x/y\", \"seed\": 123, "
                + "\"mime_type\": \"image/jpeg\"}");

        assertEquals("http://x/y", response.getUrl().orElseThrow());
        assertEquals(BigInteger.valueOf(123), response.getSeed().orElseThrow());
        assertEquals("image/jpeg", response.getMimeType().orElseThrow());
        assertTrue(response.isSuccessful());
    }

    @Test
    void accessorsReturnEmptyOnWrongTypes() throws Exception {
        ImagePigResponse response = response("{\"image_url\": 1, \"seed\": -5, \"mime_type\": null}");

        assertTrue(response.getUrl().isEmpty());
        assertTrue(response.getSeed().isEmpty());
        assertTrue(response.getMimeType().isEmpty());
        assertTrue(response.getDuration().isEmpty());
        assertTrue(response("{\"seed\": \"7\"}").getSeed().isEmpty());
        assertTrue(response("{\"seed\": 1.5}").getSeed().isEmpty());
    }

    @Test
    void seedCoversFullUnsignedRange() throws Exception {
        assertEquals(new BigInteger("18446744073709551615"),
                response("{\"seed\": 18446744073709551615}").getSeed().orElseThrow());
        assertEquals(new BigInteger("9223372036854775808"),
                response("{\"seed\": 9223372036854775808}").getSeed().orElseThrow());
        assertTrue(response("{\"seed\": 18446744073709551616}").getSeed().isEmpty());
    }

    @Test
    void durationIsDifferenceOfTimestamps() throws Exception {
        ImagePigResponse response = response("{\"started_at\": \"2024-01-01T00:00:00Z\", "
                + "\"completed_at\": \"2024-01-01T00:00:05Z\"}");

        assertEquals(Duration.ofSeconds(5), response.getDuration().orElseThrow());
    }

    @Test
    void durationRespectsOffsetsAndFractions() throws Exception {
        ImagePigResponse response = response("{\"started_at\": \"2024-01-01T03:00:00.250+03:00\", "
                + "\"completed_at\": \"2024-01-01T00:00:01Z\"}");

        assertEquals(Duration.ofMillis(750), response.getDuration().orElseThrow());
    }

    @Test
    void durationIsEmptyWhenFieldMissingOrInvalid() throws Exception {
        assertTrue(response("{\"started_at\": \"2024-01-01T00:00:00Z\"}").getDuration().isEmpty());
        assertTrue(response("{\"started_at\": \"2024-01-01T00:00:00Z\", \"completed_at\": \"yesterday\"}")
                .getDuration().isEmpty());
    }

    @Test
    void saveWritesBytesAndTruncatesExistingFile() throws Exception {
        Path target = tempDir.resolve("pig.jpeg");
        Files.writeString(target, "previous content that is longer");

        StepVerifier.create(response("{\"image_data\": \"aGVsbG8=\"}").save(target))
                .verifyComplete();

        assertArrayEquals("hello".getBytes(), Files.readAllBytes(target));
    }

    @Test
    void saveIntoMissingDirectoryIsUnexpectedResponse() throws Exception {
        Path target = tempDir.resolve("missing").resolve("pig.jpeg");

        StepVerifier.create(response("{\"image_data\": \"aGVsbG8=\"}").save(target))
                .expectErrorSatisfies(e -> assertErrorType(e, ImagePigErrorType.UNEXPECTED_RESPONSE))
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void saveWithoutImageIsMissingData() throws Exception {
        Path target = tempDir.resolve("pig.jpeg");

        StepVerifier.create(response("{}").save(target))
                .expectErrorSatisfies(e -> assertErrorType(e, ImagePigErrorType.MISSING_DATA))
                .verify();

        assertFalse(Files.exists(target));
    }

    private static void assertErrorType(Throwable e, ImagePigErrorType expected) {
        assertInstanceOf(ImagePigException.class, e);
        assertEquals(expected, ((ImagePigException) e).getErrorType());
    }
}
