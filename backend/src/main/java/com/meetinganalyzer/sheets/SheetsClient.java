package com.meetinganalyzer.sheets;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.auth.AccessTokenProvider;
import com.meetinganalyzer.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class SheetsClient {

    private static final Logger log = LoggerFactory.getLogger(SheetsClient.class);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AccessTokenProvider accessTokenProvider;
    private final String spreadsheetId;

    public SheetsClient(RestClient.Builder builder,
                        ObjectMapper objectMapper,
                        AccessTokenProvider accessTokenProvider,
                        AppProperties appProperties) {
        this.restClient = builder.baseUrl(appProperties.sheets().baseUrl()).build();
        this.objectMapper = objectMapper;
        this.accessTokenProvider = accessTokenProvider;
        this.spreadsheetId = appProperties.sheets().sheetId();
    }

    public List<List<String>> readRows(String tab) {
        JsonNode root = readJson(restClient.get()
                .uri("/v4/spreadsheets/{id}/values/{range}", spreadsheetId, quote(tab))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(String.class));

        List<List<String>> rows = new ArrayList<>();
        for (JsonNode row : root.path("values")) {
            List<String> cells = new ArrayList<>();
            for (JsonNode cell : row) {
                cells.add(cell.asText(""));
            }
            rows.add(cells);
        }
        return rows;
    }

    public void appendRow(String tab, List<String> row) {
        restClient.post()
                .uri("/v4/spreadsheets/{id}/values/{range}:append?valueInputOption=RAW&insertDataOption=INSERT_ROWS",
                        spreadsheetId, quote(tab))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("values", List.of(row)))
                .retrieve()
                .toBodilessEntity();
    }

    public void updateRow(String tab, int rowNumber, List<String> row) {
        String range = quote(tab) + "!A" + rowNumber;
        restClient.put()
                .uri("/v4/spreadsheets/{id}/values/{range}?valueInputOption=RAW", spreadsheetId, range)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("range", range, "values", List.of(row)))
                .retrieve()
                .toBodilessEntity();
    }

    public void ensureTab(String tab, List<String> headers) {
        JsonNode metadata = readJson(restClient.get()
                .uri("/v4/spreadsheets/{id}?fields=sheets.properties.title", spreadsheetId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(String.class));

        boolean exists = false;
        for (JsonNode sheet : metadata.path("sheets")) {
            if (tab.equals(sheet.path("properties").path("title").asText())) {
                exists = true;
                break;
            }
        }

        if (!exists) {
            restClient.post()
                    .uri("/v4/spreadsheets/{id}:batchUpdate", spreadsheetId)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("requests", List.of(Map.of("addSheet", Map.of("properties", Map.of("title", tab))))))
                    .retrieve()
                    .toBodilessEntity();
            log.info("Created sheet tab {}", tab);
            updateRow(tab, 1, headers);
            return;
        }

        List<List<String>> rows = readRows(tab);
        if (rows.isEmpty() || rows.get(0).size() < headers.size()) {
            updateRow(tab, 1, headers);
            log.info("Wrote header row for tab {}", tab);
        }
    }

    private JsonNode readJson(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException exception) {
            throw new IllegalStateException("Malformed Sheets response", exception);
        }
    }

    private String bearer() {
        return "Bearer " + accessTokenProvider.accessToken();
    }

    static String quote(String tab) {
        return "'" + tab.replace("'", "''") + "'";
    }
}
