package com.meetinganalyzer.auth;

import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import com.meetinganalyzer.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Component
public class GoogleCredentialsTokenProvider implements AccessTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(GoogleCredentialsTokenProvider.class);
    static final List<String> SCOPES = List.of(
            "https://www.googleapis.com/auth/drive",
            "https://www.googleapis.com/auth/spreadsheets"
    );

    private final String credentialsPath;
    private GoogleCredentials credentials;

    public GoogleCredentialsTokenProvider(AppProperties appProperties) {
        this.credentialsPath = appProperties.google() == null ? null : appProperties.google().credentialsPath();
    }

    @Override
    public String accessToken() {
        try {
            GoogleCredentials current = credentials();
            current.refreshIfExpired();
            AccessToken token = current.getAccessToken();
            if (token == null || token.getTokenValue() == null) {
                throw new IllegalStateException("Google credentials returned no access token");
            }
            return token.getTokenValue();
        } catch (IOException exception) {
            throw new IllegalStateException("Unable to obtain Google access token", exception);
        }
    }

    private synchronized GoogleCredentials credentials() throws IOException {
        if (credentials != null) {
            return credentials;
        }

        GoogleCredentials loaded;
        if (credentialsPath == null || credentialsPath.isBlank()) {
            loaded = GoogleCredentials.getApplicationDefault();
            log.info("Using application-default Google credentials");
        } else {
            try (InputStream input = Files.newInputStream(Path.of(credentialsPath))) {
                loaded = GoogleCredentials.fromStream(input);
            }
            log.info("Loaded Google credentials from {}", credentialsPath);
        }
        credentials = loaded.createScoped(SCOPES);
        return credentials;
    }
}
