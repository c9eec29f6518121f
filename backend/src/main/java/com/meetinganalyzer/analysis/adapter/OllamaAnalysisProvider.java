package com.meetinganalyzer.analysis.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.analysis.service.AnalysisProvider;
import com.meetinganalyzer.config.AppProperties;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Map;

@Component
public class OllamaAnalysisProvider implements AnalysisProvider {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.Ollama ollama;

    public OllamaAnalysisProvider(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.ollama = appProperties.ollama();
    }

    @Override
    public String name() {
        return "ollama";
    }

    @Override
    public boolean isConfigured() {
        return ollama != null && ollama.baseUrl() != null && !ollama.baseUrl().isBlank()
                && ollama.model() != null && !ollama.model().isBlank();
    }

    @Override
    public String generate(String prompt) {
        Map<String, Object> payload = Map.of(
                "model", ollama.model(),
                "stream", false,
                "format", "json",
                "prompt", prompt,
                "options", Map.of("temperature", 0.2)
        );

        try {
            String json = restClient.post()
                    .uri(ollama.baseUrl() + "/api/generate")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(String.class);

            if (json == null || json.isBlank()) {
                return "";
            }
            JsonNode root = objectMapper.readTree(json);
            return root.path("response").asText("");
        } catch (Exception exception) {
            throw new IllegalStateException("Ollama request failed: " + exception.getMessage(), exception);
        }
    }
}
