package ru.oparin.imagepig.service;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.exception.ImagePigException;
import ru.oparin.imagepig.model.enums.ImagePigErrorType;
import ru.oparin.imagepig.support.ScriptedExchangeFunction;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ImageDownloaderTest {

    private static final String URL = "http://x/y";

    private final ScriptedExchangeFunction transport = new ScriptedExchangeFunction();

    private ImageDownloader downloader(long interruptionMs) {
        ImagePigProperties.Download download = new ImagePigProperties.Download();
        download.setInterruptionMs(interruptionMs);
        return new ImageDownloader(transport.webClientBuilder(), download);
    }

    @Test
    void retriesNotFoundWithOneSecondPauses() {
        transport.respondTimes(3, HttpStatus.NOT_FOUND).respond(HttpStatus.OK, "hello");
        ImageDownloader downloader = downloader(1000);

        StepVerifier.withVirtualTime(() -> downloader.download(URL))
                .expectSubscription()
                .thenAwait(Duration.ofMillis(2999))
                .then(() -> assertEquals(3, transport.getRequests().size()))
                .thenAwait(Duration.ofMillis(1))
                .assertNext(bytes -> assertArrayEquals("hello".getBytes(), bytes))
                .verifyComplete();

        assertEquals(4, transport.getRequests().size());
    }

    @Test
    void sendsBrowserUserAgent() {
        transport.respond(HttpStatus.OK, "hello");

        StepVerifier.create(downloader(0).download(URL))
                .expectNextCount(1)
                .verifyComplete();

        assertEquals("Mozilla/5.0", transport.lastRequest().headers().getFirst(HttpHeaders.USER_AGENT));
        assertEquals(URL, transport.lastRequest().url().toString());
    }

    @Test
    void stopsAfterTenNotFound() {
        transport.respondTimes(10, HttpStatus.NOT_FOUND);

        StepVerifier.create(downloader(0).download(URL))
                .expectErrorSatisfies(e -> assertMissingData(e))
                .verify(Duration.ofSeconds(5));

        assertEquals(10, transport.getRequests().size());
    }

    @Test
    void serverErrorStopsWithoutRetry() {
        transport.respond(HttpStatus.INTERNAL_SERVER_ERROR).respond(HttpStatus.OK, "hello");

        StepVerifier.create(downloader(0).download(URL))
                .expectErrorSatisfies(e -> assertMissingData(e))
                .verify(Duration.ofSeconds(5));

        assertEquals(1, transport.getRequests().size());
    }

    @Test
    void transportErrorStopsWithoutRetry() {
        transport.respond(HttpStatus.NOT_FOUND).failConnection().respond(HttpStatus.OK, "hello");

        StepVerifier.create(downloader(0).download(URL))
                .expectErrorSatisfies(e -> assertMissingData(e))
                .verify(Duration.ofSeconds(5));

        assertEquals(2, transport.getRequests().size());
    }

    @Test
    void malformedUrlIsMissingDataWithoutRequest() {
        StepVerifier.create(downloader(0).download("not a url"))
                .expectErrorSatisfies(e -> assertMissingData(e))
                .verify(Duration.ofSeconds(5));

        assertTrue(transport.getRequests().isEmpty());
    }

    @Test
    void cancellationStopsRetryLoop() {
        transport.respondTimes(10, HttpStatus.NOT_FOUND);
        ImageDownloader downloader = downloader(1000);

        StepVerifier.withVirtualTime(() -> downloader.download(URL))
                .expectSubscription()
                .thenAwait(Duration.ofMillis(1500))
                .thenCancel()
                .verify();

        assertEquals(2, transport.getRequests().size());
    }

    private static void assertMissingData(Throwable e) {
        assertInstanceOf(ImagePigException.class, e);
        assertEquals(ImagePigErrorType.MISSING_DATA, ((ImagePigException) e).getErrorType());
    }
}
