package com.meetinganalyzer.drive.service;

import com.meetinganalyzer.drive.model.ObjectChunk;
import com.meetinganalyzer.drive.model.SourceObject;

import java.util.List;

public interface ObjectStore {

    List<SourceObject> listFolders(String parentId);

    List<SourceObject> listMedia(String folderId);

    List<SourceObject> listChildren(String folderId);

    ObjectChunk readChunk(String objectId, long offset, long length);

    List<String> getParents(String objectId);

    void updateParents(String objectId, String addParent, List<String> removeParents);

    void annotate(String objectId, String description);
}
