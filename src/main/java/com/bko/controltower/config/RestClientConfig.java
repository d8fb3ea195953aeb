package com.bko.controltower.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;

import java.io.IOException;

@Configuration
public class RestClientConfig {

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
    }

    /**
     * Logs agent traffic without bodies; task requests carry base64 images.
     */
    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final org.slf4j.Logger httpLogger =
                org.slf4j.LoggerFactory.getLogger("com.bko.controltower.http.logging");

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            long started = System.nanoTime();
            httpLogger.info("--> {} {} ({} bytes)", request.getMethod(), request.getURI(), body.length);
            ClientHttpResponse response;
            try {
                response = execution.execute(request, body);
            } catch (IOException ex) {
                httpLogger.info("<-- {} {} failed after {} ms: {}", request.getMethod(), request.getURI(),
                        elapsedMillis(started), ex.getMessage());
                throw ex;
            }
            httpLogger.info("<-- {} {} {} in {} ms", request.getMethod(), request.getURI(),
                    response.getStatusCode().value(), elapsedMillis(started));
            return response;
        }

        private long elapsedMillis(long started) {
            return (System.nanoTime() - started) / 1_000_000L;
        }
    }
}
