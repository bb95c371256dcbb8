package com.planrunner.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Shared customization for every {@code RestClient.Builder}: model provider calls and web document fetches.
 */
@Configuration
public class RestClientConfig {

    static final int MAX_LOGGED_BODY_CHARS = 2_000;

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // response body is read twice when HTTP logging is on
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger("com.planrunner.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            normalizeAuthorization(request.getHeaders());
            long started = System.nanoTime();
            if (httpLogger.isDebugEnabled()) {
                httpLogger.debug("--> {} {} ({} bytes)", request.getMethod(), request.getURI(), body.length);
                if (body.length > 0) {
                    httpLogger.debug("Request body: {}", abbreviate(new String(body, StandardCharsets.UTF_8)));
                }
            }
            ClientHttpResponse response = execution.execute(request, body);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            httpLogger.info("{} {} -> {} in {} ms", request.getMethod(), request.getURI(), response.getStatusCode(), elapsedMs);
            if (httpLogger.isDebugEnabled()) {
                byte[] responseBody = StreamUtils.copyToByteArray(response.getBody());
                if (responseBody.length > 0) {
                    httpLogger.debug("Response body: {}", abbreviate(new String(responseBody, StandardCharsets.UTF_8)));
                }
            }
            return response;
        }

        // OpenAI-compatible local providers reject a placeholder bearer token
        static void normalizeAuthorization(HttpHeaders headers) {
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth == null) {
                return;
            }
            String trimmed = auth.trim();
            if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                headers.remove(HttpHeaders.AUTHORIZATION);
            }
        }

        private static String abbreviate(String text) {
            return text.length() <= MAX_LOGGED_BODY_CHARS ? text : text.substring(0, MAX_LOGGED_BODY_CHARS) + "...";
        }
    }
}
