package com.meetinganalyzer.drive.service;

import com.meetinganalyzer.config.AppProperties;
import com.meetinganalyzer.drive.model.SourceObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
public class FolderDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(FolderDiscoveryService.class);
    private static final Set<String> RESERVED_FOLDERS = Set.of("processed meetings", "quarantined meetings");

    private final ObjectStore objectStore;
    private final AppProperties appProperties;

    public FolderDiscoveryService(ObjectStore objectStore, AppProperties appProperties) {
        this.objectStore = objectStore;
        this.appProperties = appProperties;
    }

    public Map<String, String> discoverMemberFolders() {
        Map<String, String> members = new LinkedHashMap<>();
        List<SourceObject> cities;
        try {
            cities = objectStore.listFolders(appProperties.drive().parentFolderId());
        } catch (RuntimeException exception) {
            log.error("Unable to list city folders", exception);
            return members;
        }

        for (SourceObject city : cities) {
            if (isReserved(city.name())) {
                continue;
            }
            try {
                for (SourceObject member : objectStore.listFolders(city.id())) {
                    if (!isReserved(member.name())) {
                        members.putIfAbsent(member.name(), member.id());
                    }
                }
            } catch (RuntimeException exception) {
                log.error("Unable to list member folders of {}", city.name(), exception);
            }
        }
        log.info("Discovered {} member folders", members.size());
        return members;
    }

    public List<SourceObject> listPending(String folderId) {
        try {
            return objectStore.listMedia(folderId).stream()
                    .filter(SourceObject::isMedia)
                    .filter(object -> !object.isEmptyFile())
                    .toList();
        } catch (RuntimeException exception) {
            log.error("Unable to list media in folder {}", folderId, exception);
            return List.of();
        }
    }

    private boolean isReserved(String name) {
        return name != null && RESERVED_FOLDERS.contains(name.trim().toLowerCase(Locale.ROOT));
    }
}
