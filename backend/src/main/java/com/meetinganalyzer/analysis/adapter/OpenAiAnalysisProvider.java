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
public class OpenAiAnalysisProvider implements AnalysisProvider {

    private static final String SYSTEM_PROMPT = """
            You analyze sales meeting transcripts.
            Answer with one JSON object only, using exactly the keys the user asks for.
            Do not add commentary or markdown.
            """;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AppProperties.OpenAi openAi;

    public OpenAiAnalysisProvider(RestClient.Builder builder, ObjectMapper objectMapper, AppProperties appProperties) {
        this.restClient = builder.build();
        this.objectMapper = objectMapper;
        this.openAi = appProperties.openai();
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    public boolean isConfigured() {
        return openAi != null && openAi.apiKey() != null && !openAi.apiKey().isBlank();
    }

    @Override
    public String generate(String prompt) {
        String model = openAi.model();
        if (model == null || model.isBlank()) {
            model = "gpt-4o-mini";
        }

        Map<String, Object> payload = Map.of(
                "model", model,
                "temperature", 0.2,
                "response_format", Map.of("type", "json_object"),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                )
        );

        try {
            String rawResponse = restClient.post()
                    .uri(openAi.baseUrl() + "/v1/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header("Authorization", "Bearer " + openAi.apiKey())
                    .body(payload)
                    .retrieve()
                    .body(String.class);

            return extractMessageText(rawResponse);
        } catch (Exception exception) {
            throw new IllegalStateException("OpenAI analysis request failed: " + exception.getMessage(), exception);
        }
    }

    private String extractMessageText(String rawResponse) throws Exception {
        if (rawResponse == null || rawResponse.isBlank()) {
            return "";
        }

        JsonNode root = objectMapper.readTree(rawResponse);
        JsonNode messageContent = root.path("choices").path(0).path("message").path("content");

        if (messageContent.isTextual()) {
            return messageContent.asText();
        }

        if (messageContent.isArray()) {
            StringBuilder text = new StringBuilder();
            for (JsonNode part : messageContent) {
                if (part.isTextual()) {
                    text.append(part.asText());
                    continue;
                }
                text.append(part.path("text").asText(""));
            }
            return text.toString();
        }

        return "";
    }
}
