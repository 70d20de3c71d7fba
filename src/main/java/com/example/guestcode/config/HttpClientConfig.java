package com.example.guestcode.config;

import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.auth.http.HttpTransportFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

@Configuration
public class HttpClientConfig {

    private static final int DRIVE_MAX_IN_MEMORY = 10 * 1024 * 1024;

    /** Lock API client, every call carries the bearer token. */
    @Bean
    public RestTemplate nukiRestTemplate(RestTemplateBuilder builder,
                                         @Value("${nuki.api.token}") String token,
                                         @Value("${http.timeout-seconds}") long timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public WebClient googleWebClient(WebClient.Builder builder) {
        return builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(DRIVE_MAX_IN_MEMORY))
                .build();
    }

    /** Transport of the Google OAuth calls (token refresh, authorization). */
    @Bean
    public HttpTransportFactory googleTransportFactory() {
        NetHttpTransport transport = new NetHttpTransport();
        return () -> transport;
    }
}
