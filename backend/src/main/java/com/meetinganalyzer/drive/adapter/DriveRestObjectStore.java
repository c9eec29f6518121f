package com.meetinganalyzer.drive.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.auth.AccessTokenProvider;
import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.ObjectChunk;
import com.meetinganalyzer.drive.model.SourceObject;
import com.meetinganalyzer.drive.service.ObjectStore;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Component
public class DriveRestObjectStore implements ObjectStore {

    private static final String FILE_FIELDS = "id,name,mimeType,createdTime,size,parents";
    private static final String LIST_FIELDS = "nextPageToken,files(" + FILE_FIELDS + ")";
    private static final int PAGE_SIZE = 1000;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AccessTokenProvider accessTokenProvider;

    public DriveRestObjectStore(RestClient.Builder builder,
                                ObjectMapper objectMapper,
                                AccessTokenProvider accessTokenProvider,
                                AppProperties appProperties) {
        this.restClient = builder.baseUrl(appProperties.drive().baseUrl()).build();
        this.objectMapper = objectMapper;
        this.accessTokenProvider = accessTokenProvider;
    }

    @Override
    public List<SourceObject> listFolders(String parentId) {
        String query = "'" + escape(parentId) + "' in parents and mimeType = '"
                + SourceObject.FOLDER_MIME_TYPE + "' and trashed = false";
        return list(parentId, query, "name");
    }

    @Override
    public List<SourceObject> listMedia(String folderId) {
        String query = "'" + escape(folderId) + "' in parents and trashed = false"
                + " and (mimeType contains 'audio/' or mimeType contains 'video/')";
        return list(folderId, query, "createdTime");
    }

    @Override
    public List<SourceObject> listChildren(String folderId) {
        String query = "'" + escape(folderId) + "' in parents and trashed = false";
        return list(folderId, query, "createdTime");
    }

    @Override
    public ObjectChunk readChunk(String objectId, long offset, long length) {
        String range = "bytes=" + offset + "-" + (offset + length - 1);
        try {
            ResponseEntity<byte[]> response = restClient.get()
                    .uri("/drive/v3/files/{id}?alt=media&supportsAllDrives=true", objectId)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .header(HttpHeaders.RANGE, range)
                    .retrieve()
                    .toEntity(byte[].class);

            byte[] data = response.getBody() == null ? new byte[0] : response.getBody();
            if (response.getStatusCode().value() == HttpStatus.PARTIAL_CONTENT.value()) {
                String contentRange = response.getHeaders().getFirst(HttpHeaders.CONTENT_RANGE);
                return new ObjectChunk(data, totalFromContentRange(contentRange));
            }
            // Plain 200: the server ignored the range and sent the whole object.
            if (offset > 0) {
                byte[] tail = offset >= data.length ? new byte[0] : Arrays.copyOfRange(data, (int) offset, data.length);
                return new ObjectChunk(tail, data.length);
            }
            return new ObjectChunk(data, data.length);
        } catch (RestClientResponseException exception) {
            if (exception.getStatusCode().value() == HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE.value()) {
                return new ObjectChunk(new byte[0], offset);
            }
            throw DriveErrors.translate("Download", objectId, exception);
        } catch (RuntimeException exception) {
            throw DriveErrors.translate("Download", objectId, exception);
        }
    }

    @Override
    public List<String> getParents(String objectId) {
        JsonNode root = call("Parent lookup", objectId, () -> restClient.get()
                .uri("/drive/v3/files/{id}?fields=parents&supportsAllDrives=true", objectId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(String.class));

        List<String> parents = new ArrayList<>();
        for (JsonNode parent : root.path("parents")) {
            parents.add(parent.asText());
        }
        return parents;
    }

    @Override
    public void updateParents(String objectId, String addParent, List<String> removeParents) {
        String remove = removeParents == null ? "" : String.join(",", removeParents);
        call("Move", objectId, () -> restClient.patch()
                .uri("/drive/v3/files/{id}?addParents={add}&removeParents={remove}&fields=id,parents&supportsAllDrives=true",
                        objectId, addParent, remove)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of())
                .retrieve()
                .body(String.class));
    }

    @Override
    public void annotate(String objectId, String description) {
        call("Annotate", objectId, () -> restClient.patch()
                .uri("/drive/v3/files/{id}?fields=id&supportsAllDrives=true", objectId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("description", description))
                .retrieve()
                .body(String.class));
    }

    private List<SourceObject> list(String folderId, String query, String orderBy) {
        List<SourceObject> objects = new ArrayList<>();
        String pageToken = null;
        do {
            Map<String, Object> variables = new HashMap<>();
            variables.put("q", query);
            variables.put("fields", LIST_FIELDS);
            variables.put("orderBy", orderBy);
            String template = "/drive/v3/files?q={q}&fields={fields}&orderBy={orderBy}&pageSize=" + PAGE_SIZE
                    + "&supportsAllDrives=true&includeItemsFromAllDrives=true";
            if (pageToken != null) {
                variables.put("pageToken", pageToken);
                template = template + "&pageToken={pageToken}";
            }

            String uriTemplate = template;
            JsonNode page = call("Listing", folderId, () -> restClient.get()
                    .uri(uriTemplate, variables)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .retrieve()
                    .body(String.class));

            for (JsonNode file : page.path("files")) {
                objects.add(toSourceObject(file));
            }
            String next = page.path("nextPageToken").asText("");
            pageToken = next.isBlank() ? null : next;
        } while (pageToken != null);
        return objects;
    }

    private JsonNode call(String operation, String objectId, Supplier<String> request) {
        try {
            String body = request.get();
            if (body == null || body.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(body);
        } catch (RuntimeException exception) {
            throw DriveErrors.translate(operation, objectId, exception);
        } catch (IOException exception) {
            throw DriveErrors.translate(operation, objectId, new IllegalStateException("Malformed Drive response", exception));
        }
    }

    private SourceObject toSourceObject(JsonNode file) {
        List<String> parents = new ArrayList<>();
        for (JsonNode parent : file.path("parents")) {
            parents.add(parent.asText());
        }
        long size = file.hasNonNull("size") ? file.path("size").asLong(SourceObject.UNKNOWN_SIZE) : SourceObject.UNKNOWN_SIZE;
        return new SourceObject(
                file.path("id").asText(),
                file.path("name").asText(""),
                file.path("mimeType").asText(""),
                parseInstant(file.path("createdTime").asText(null)),
                size,
                parents
        );
    }

    private Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException exception) {
            return null;
        }
    }

    static long totalFromContentRange(String contentRange) {
        if (contentRange == null) {
            return ObjectChunk.UNKNOWN_TOTAL;
        }
        int slash = contentRange.lastIndexOf('/');
        if (slash < 0 || slash == contentRange.length() - 1) {
            return ObjectChunk.UNKNOWN_TOTAL;
        }
        String total = contentRange.substring(slash + 1).trim();
        try {
            return "*".equals(total) ? ObjectChunk.UNKNOWN_TOTAL : Long.parseLong(total);
        } catch (NumberFormatException exception) {
            return ObjectChunk.UNKNOWN_TOTAL;
        }
    }

    private String bearer() {
        return "Bearer " + accessTokenProvider.accessToken();
    }

    private static String escape(String id) {
        return id == null ? "" : id.replace("\\", "\\\\").replace("'", "\\'");
    }
}
