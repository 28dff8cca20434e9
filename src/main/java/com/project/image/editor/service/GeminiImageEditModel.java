package com.project.image.editor.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.project.image.editor.DTOs.GeminiRequest;
import com.project.image.editor.DTOs.Snapshot;
import com.project.image.editor.exceptions.ExternalEditException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;

/**
 * {@link ImageEditModel} backed by the Gemini {@code generateContent} REST endpoint.
 */
@Service
public class GeminiImageEditModel implements ImageEditModel {
    private static final Logger log = LoggerFactory.getLogger(GeminiImageEditModel.class);

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestClient restClient;
    private final String model;
    private final String apiKey;

    public GeminiImageEditModel(@Qualifier("geminiRestClient") RestClient restClient,
                                @Value("${app.gemini.model:gemini-2.5-flash-image}") String model,
                                @Value("${app.gemini.api-key:}") String apiKey) {
        this.restClient = restClient;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public Snapshot edit(Snapshot image, String instruction) {
        if (!StringUtils.hasText(apiKey)) {
            throw new ExternalEditException("The image model API key is not configured");
        }

        GeminiRequest request = GeminiRequest.imageEdit(
                image.mimeType(), Base64.getEncoder().encodeToString(image.data()), instruction);

        JsonNode response;
        try {
            log.info("Calling {} with {}", model, image);
            response = restClient.post()
                    .uri("/v1beta/models/{model}:generateContent", model)
                    .header(API_KEY_HEADER, apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException e) {
            log.warn("Image model answered {}: {}", e.getStatusCode(), e.getResponseBodyAsString());
            throw new ExternalEditException("Image model request failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ExternalEditException("Image model request failed: " + e.getMessage(), e);
        }

        return extractImage(response);
    }

    private Snapshot extractImage(JsonNode response) {
        if (response != null) {
            for (JsonNode part : response.path("candidates").path(0).path("content").path("parts")) {
                JsonNode inline = part.path("inlineData");
                String data = inline.path("data").asText("");
                if (!data.isEmpty()) {
                    String mimeType = inline.path("mimeType").asText(Snapshot.PNG);
                    try {
                        Snapshot result = new Snapshot(Base64.getDecoder().decode(data), mimeType);
                        log.info("Image model returned {}", result);
                        return result;
                    } catch (IllegalArgumentException e) {
                        throw new ExternalEditException("Image model returned unusable image data", e);
                    }
                }
            }
        }
        log.warn("Image model response carried no image: {}", response);
        throw new ExternalEditException("The AI did not return a valid image. Please try again.");
    }
}
