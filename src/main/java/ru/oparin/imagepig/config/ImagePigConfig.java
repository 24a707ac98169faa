package ru.oparin.imagepig.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import jakarta.validation.Validator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import ru.oparin.imagepig.config.properties.ImagePigProperties;
import ru.oparin.imagepig.mapper.ImagePigRequestMapper;
import ru.oparin.imagepig.service.ImagePigClient;

import java.time.Duration;

/**
 * Конфигурация клиента ImagePig.
 */
@Configuration
@EnableConfigurationProperties(ImagePigProperties.class)
public class ImagePigConfig {

    /**
     * Максимальный размер тела ответа в памяти: ответы содержат изображения целиком.
     */
    private static final int MAX_IN_MEMORY_SIZE = 64 * 1024 * 1024;

    @Bean
    public ImagePigRequestMapper imagePigRequestMapper(ObjectProvider<Validator> validator) {
        return new ImagePigRequestMapper(validator.getIfAvailable(ImagePigRequestMapper::defaultValidator));
    }

    @Bean
    public ImagePigClient imagePigClient(ImagePigProperties properties,
                                         ObjectProvider<WebClient.Builder> webClientBuilder,
                                         ObjectProvider<ObjectMapper> objectMapper,
                                         ImagePigRequestMapper imagePigRequestMapper) {
        WebClient.Builder builder = webClientBuilder.getIfAvailable(WebClient::builder).clone();
        return new ImagePigClient(
                properties,
                configureWebClient(builder, properties),
                objectMapper.getIfAvailable(ObjectMapper::new),
                imagePigRequestMapper);
    }

    /**
     * Настроить WebClient: таймауты Reactor Netty и размер буфера ответа.
     *
     * @param builder    builder для настройки
     * @param properties свойства клиента
     * @return тот же builder
     */
    public static WebClient.Builder configureWebClient(WebClient.Builder builder, ImagePigProperties properties) {
        ImagePigProperties.Http http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofMillis(http.getRequestTimeoutMs()))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, http.getConnectTimeoutMs());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
    }
}
