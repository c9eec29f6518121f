package com.meetinganalyzer.drive.model;

import java.time.Instant;
import java.util.List;

public record SourceObject(
        String id,
        String name,
        String mimeType,
        Instant createdTime,
        long sizeBytes,
        List<String> parents
) {

    public static final String FOLDER_MIME_TYPE = "application/vnd.google-apps.folder";
    public static final long UNKNOWN_SIZE = -1L;

    public SourceObject {
        parents = parents == null ? List.of() : List.copyOf(parents);
    }

    public String parentId() {
        return parents.isEmpty() ? null : parents.get(0);
    }

    public boolean isFolder() {
        return FOLDER_MIME_TYPE.equals(mimeType);
    }

    public boolean isMedia() {
        return mimeType != null && (mimeType.startsWith("audio/") || mimeType.startsWith("video/"));
    }

    public boolean isEmptyFile() {
        return sizeBytes == 0;
    }

    public String viewLink() {
        return "https://drive.google.com/file/d/" + id + "/view";
    }
}
