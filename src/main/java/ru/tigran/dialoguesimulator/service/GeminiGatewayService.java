package ru.tigran.dialoguesimulator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import ru.tigran.dialoguesimulator.dto.GenerationParams;
import ru.tigran.dialoguesimulator.dto.GenerationRequest;
import ru.tigran.dialoguesimulator.exception.ErrorCode;
import ru.tigran.dialoguesimulator.exception.ProviderException;
import ru.tigran.dialoguesimulator.exception.QuotaExhaustedException;

import java.nio.charset.StandardCharsets;

/**
 * Completion provider backed by the Gemini {@code generateContent} REST endpoint.
 *
 * One HTTP call per {@link #generate(GenerationRequest)}, no retries here: retry, backoff and
 * fallback are owned by the conversation simulator, and admission by the rate limiter.
 *
 * Error mapping:
 * - 429 or a body containing RESOURCE_EXHAUSTED: {@link QuotaExhaustedException} carrying the raw body
 * - 5xx: retriable {@link ProviderException}
 * - other 4xx: non-retriable {@link ProviderException}
 * - empty candidate text or unparseable body: {@link ProviderException} with INVALID_AI_RESPONSE
 */
@Slf4j
@Service
public class GeminiGatewayService implements CompletionProvider {

    private static final String QUOTA_MARKER = "RESOURCE_EXHAUSTED";
    // Maximum response size (1 MB)
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;

    public GeminiGatewayService(
            RestClient geminiRestClient,
            ObjectMapper objectMapper,
            @Value("${app.gemini.api-key:}") String apiKey,
            @Value("${app.gemini.base-url}") String baseUrl
    ) {
        this.restClient = geminiRestClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
    }

    @Override
    public String generate(GenerationRequest request) {
        log.debug("generateContent - model={}, prompt length={}", request.model(), request.prompt().length());
        String requestBody = buildRequestBody(request);

        String response;
        try {
            response = restClient.post()
                    .uri(baseUrl + "/models/{model}:generateContent?key={key}", request.model(), apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (httpRequest, httpResponse) -> {
                        int statusCode = httpResponse.getStatusCode().value();
                        String errorBody = new String(httpResponse.getBody().readAllBytes(), StandardCharsets.UTF_8);

                        if (statusCode == 429 || errorBody.contains(QUOTA_MARKER)) {
                            log.warn("Gemini quota exhausted: HTTP {}", statusCode);
                            throw new QuotaExhaustedException(
                                    "Gemini quota exhausted: " + statusCode + " " + QUOTA_MARKER,
                                    errorBody
                            );
                        }

                        if (httpResponse.getStatusCode().is5xxServerError()) {
                            log.warn("Retriable HTTP error {} from Gemini", statusCode);
                            throw new ProviderException(
                                    "Gemini server error: " + statusCode,
                                    ErrorCode.AI_SERVICE_ERROR,
                                    true
                            );
                        }

                        log.error("Gemini API error: {} {}", statusCode, abbreviate(errorBody, 200));
                        throw new ProviderException(
                                "Gemini API error: " + statusCode,
                                ErrorCode.AI_SERVICE_ERROR,
                                false
                        );
                    })
                    .body(String.class);
        } catch (ResourceAccessException e) {
            throw new ProviderException(
                    "Gemini API unreachable: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_ERROR,
                    true,
                    e
            );
        }

        String text = extractText(response);
        log.debug("Gemini response (first 200 chars): {}", abbreviate(text, 200));
        return text;
    }

    /**
     * Builds the generateContent request body:
     * {@code {contents: [{parts: [{text}]}], generationConfig: {...}, tools: [{google_search: {}}]?}}
     */
    private String buildRequestBody(GenerationRequest request) {
        try {
            ObjectNode rootNode = objectMapper.createObjectNode();
            rootNode.putArray("contents")
                    .addObject()
                    .putArray("parts")
                    .addObject()
                    .put("text", request.prompt());

            GenerationParams params = request.params();
            ObjectNode config = rootNode.putObject("generationConfig");
            config.put("temperature", params.temperature());
            config.put("topP", params.topP());
            if (params.topK() != null) {
                config.put("topK", params.topK());
            }
            config.put("maxOutputTokens", params.maxOutputTokens());

            if (params.searchGrounding()) {
                rootNode.putArray("tools").addObject().putObject("google_search");
            }

            return objectMapper.writeValueAsString(rootNode);
        } catch (Exception e) {
            throw new ProviderException(
                    "Failed to build request body",
                    ErrorCode.AI_SERVICE_ERROR,
                    false,
                    e
            );
        }
    }

    /**
     * Joins the text parts of the first candidate.
     */
    private String extractText(String response) {
        if (response == null || response.isBlank()) {
            throw new ProviderException("Empty response from Gemini", ErrorCode.INVALID_AI_RESPONSE);
        }
        if (response.length() > MAX_RESPONSE_SIZE_BYTES) {
            throw new ProviderException(
                    String.format("Gemini response exceeds %d bytes", MAX_RESPONSE_SIZE_BYTES),
                    ErrorCode.INVALID_AI_RESPONSE
            );
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ProviderException(
                    "Failed to parse Gemini response: " + e.getMessage(),
                    ErrorCode.INVALID_AI_RESPONSE,
                    false,
                    e
            );
        }

        JsonNode parts = root.at("/candidates/0/content/parts");
        StringBuilder text = new StringBuilder();
        if (parts.isArray()) {
            for (JsonNode part : parts) {
                JsonNode partText = part.get("text");
                if (partText != null && partText.isTextual()) {
                    text.append(partText.asText());
                }
            }
        }

        String result = text.toString().strip();
        if (result.isEmpty()) {
            String finishReason = root.at("/candidates/0/finishReason").asText("NONE");
            log.error("Missing text in Gemini response, finishReason={}", finishReason);
            throw new ProviderException(
                    "Missing text in Gemini response (finishReason=" + finishReason + ")",
                    ErrorCode.INVALID_AI_RESPONSE
            );
        }
        return result;
    }

    private static String abbreviate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) + "..." : value;
    }
}
