package com.meetinganalyzer.pipeline.model;

import com.meetinganalyzer.drive.model.SourceObject;

public record WorkItem(SourceObject source, String ownerName, String folderId) {
}
