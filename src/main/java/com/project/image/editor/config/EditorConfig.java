package com.project.image.editor.config;

import com.project.image.editor.DTOs.ChromaKeyConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Beans built from {@code app.*} properties: the chroma key tolerances and the HTTP client
 * for the external image model. A timeout on that client surfaces as a failed edit.
 */
@Configuration
public class EditorConfig {
    private static final Logger log = LoggerFactory.getLogger(EditorConfig.class);

    @Bean
    public ChromaKeyConfig chromaKeyConfig(
            @Value("${app.chroma-key.reference-color:#FF00FF}") String referenceColor,
            @Value("${app.chroma-key.hue-tolerance:25}") double hueTolerance,
            @Value("${app.chroma-key.min-saturation:0.25}") double minSaturation,
            @Value("${app.chroma-key.min-lightness:0.15}") double minLightness,
            @Value("${app.chroma-key.max-lightness:0.95}") double maxLightness) {
        ChromaKeyConfig config = ChromaKeyConfig.forReferenceColor(
                referenceColor, hueTolerance, minSaturation, minLightness, maxLightness);
        log.info("Chroma key: {}", config);
        return config;
    }

    @Bean
    public RestClient geminiRestClient(
            RestClient.Builder builder,
            @Value("${app.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
            @Value("${app.gemini.timeout:PT90S}") Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) Duration.ofSeconds(10).toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return builder
                .baseUrl(baseUrl)
                .requestFactory(factory)
                .build();
    }
}
