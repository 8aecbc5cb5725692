package ru.tigran.dialoguesimulator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * HTTP-клиент для провайдера генерации текста (Gemini)
 */
@Configuration
public class ProviderConfig {

    /**
     * Синхронный RestClient с таймаутами на соединение и чтение
     */
    @Bean
    public RestClient geminiRestClient(@Value("${app.gemini.timeout:30s}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        return RestClient.builder()
                .requestFactory(requestFactory)
                .build();
    }
}
