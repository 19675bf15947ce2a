package com.bbthechange.roomsync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * HTTP client used for every call to the Matrix homeserver.
 * Per-request deadlines are applied by the client wrapper; this only bounds connection setup.
 */
@Configuration
public class MatrixClientConfig {

    private final MatrixProperties properties;

    public MatrixClientConfig(MatrixProperties properties) {
        this.properties = properties;
    }

    @Bean("matrixHttpClient")
    public HttpClient matrixHttpClient() {
        return HttpClient.newBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
    }
}
