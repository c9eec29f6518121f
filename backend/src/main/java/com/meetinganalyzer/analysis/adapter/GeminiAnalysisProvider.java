package com.meetinganalyzer.analysis.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.analysis.service.AnalysisProvider;
import com.meetinganalyzer.config.AppProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

@Component
public class GeminiAnalysisProvider implements AnalysisProvider {

    private static final String DEFAULT_MODEL = "gemini-1.5-flash";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.Gemini gemini;

    public GeminiAnalysisProvider(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.gemini = appProperties.gemini();
    }

    @Override
    public String name() {
        return "gemini";
    }

    @Override
    public boolean isConfigured() {
        return gemini != null && gemini.apiKey() != null && !gemini.apiKey().isBlank();
    }

    @Override
    public String generate(String prompt) {
        String model = gemini.model() == null || gemini.model().isBlank() ? DEFAULT_MODEL : gemini.model();
        Map<String, Object> payload = Map.of(
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt))
                )),
                "generationConfig", Map.of(
                        "temperature", gemini.temperature(),
                        "responseMimeType", "application/json"
                )
        );

        try {
            String rawResponse = restClient.post()
                    .uri(gemini.baseUrl() + "/v1beta/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("x-goog-api-key", gemini.apiKey())
                    .body(payload)
                    .retrieve()
                    .body(String.class);

            return extractText(rawResponse);
        } catch (Exception exception) {
            throw new IllegalStateException("Gemini request failed: " + exception.getMessage(), exception);
        }
    }

    private String extractText(String rawResponse) throws Exception {
        if (rawResponse == null || rawResponse.isBlank()) {
            return "";
        }

        JsonNode root = objectMapper.readTree(rawResponse);
        String blockReason = root.path("promptFeedback").path("blockReason").asText("");
        if (!blockReason.isBlank()) {
            throw new IllegalStateException("Gemini blocked the prompt: " + blockReason);
        }

        JsonNode candidate = root.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        if (text.isEmpty() && "SAFETY".equals(candidate.path("finishReason").asText())) {
            throw new IllegalStateException("Gemini stopped for safety reasons");
        }
        return text.toString();
    }
}
