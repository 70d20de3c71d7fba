package com.example.guestcode.service;

import com.example.guestcode.dto.GoogleTokenDTO;
import com.example.guestcode.service.exception.ConfigurationException;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.extensions.java6.auth.oauth2.AuthorizationCodeInstalledApp;
import com.google.api.client.extensions.jetty.auth.oauth2.LocalServerReceiver;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.json.gson.GsonFactory;
import com.google.auth.http.HttpTransportFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One-time installed-app consent for read-only Drive access. Keeps a token
 * file that still works, otherwise deletes it and asks the user again in
 * the browser.
 */
@Slf4j
@Service
public class GoogleAuthorizer {

    static final String DRIVE_READONLY = "https://www.googleapis.com/auth/drive.readonly";
    private static final String CLIENT_SECRET_GLOB = "client_secret*.json";
    private static final String CREDENTIALS_FILE = "credentials.json";

    private final GoogleTokenStore tokenStore;
    private final HttpTransportFactory googleTransportFactory;
    private final String clientSecretsPath;

    public GoogleAuthorizer(GoogleTokenStore tokenStore,
                            HttpTransportFactory googleTransportFactory,
                            @Value("${google.client-secrets-path}") String clientSecretsPath) {
        this.tokenStore = tokenStore;
        this.googleTransportFactory = googleTransportFactory;
        this.clientSecretsPath = clientSecretsPath;
    }

    /** Makes sure the token file holds usable credentials. */
    public Path authorize() throws IOException {
        Path tokenFile = tokenStore.tokenFile();
        if (tokenStore.isAuthorized()) {
            log.info("Google token in {} is valid, nothing to do", tokenFile);
            return tokenFile;
        }
        if (Files.deleteIfExists(tokenFile)) {
            log.warn("Old Google token {} deleted, starting a new authorization", tokenFile);
        }

        Path secretsFile = findClientSecrets(tokenFile)
                .orElseThrow(() -> new ConfigurationException("No " + CLIENT_SECRET_GLOB + " or " + CREDENTIALS_FILE
                        + " found, download the OAuth client from the Google Cloud Console"));
        log.info("Using OAuth client {}", secretsFile);

        GoogleClientSecrets secrets;
        try (Reader reader = Files.newBufferedReader(secretsFile, StandardCharsets.UTF_8)) {
            secrets = GoogleClientSecrets.load(GsonFactory.getDefaultInstance(), reader);
        }
        if (secrets.getDetails() == null) {
            throw new ConfigurationException(secretsFile + " is not an installed-app OAuth client");
        }

        Credential credential = runInstalledAppFlow(secrets);
        if (credential.getRefreshToken() == null) {
            log.warn("Google returned no refresh token, the token will stop working when it expires");
        }
        tokenStore.save(toTokenFile(secrets, credential));
        log.info("Google token saved to {}", tokenFile);
        return tokenFile;
    }

    Credential runInstalledAppFlow(GoogleClientSecrets secrets) throws IOException {
        GoogleAuthorizationCodeFlow flow = new GoogleAuthorizationCodeFlow.Builder(
                googleTransportFactory.create(), GsonFactory.getDefaultInstance(), secrets, List.of(DRIVE_READONLY))
                .setAccessType("offline")
                .setApprovalPrompt("force")
                .build();
        return new AuthorizationCodeInstalledApp(flow, new LocalServerReceiver()).authorize("user");
    }

    Optional<Path> findClientSecrets(Path tokenFile) throws IOException {
        if (clientSecretsPath != null && !clientSecretsPath.isBlank()) {
            Path configured = Path.of(clientSecretsPath);
            if (!Files.isRegularFile(configured)) {
                throw new ConfigurationException("OAuth client file " + configured + " does not exist");
            }
            return Optional.of(configured);
        }

        Set<Path> directories = new LinkedHashSet<>();
        Path parent = tokenFile.toAbsolutePath().getParent();
        if (parent != null) {
            directories.add(parent);
        }
        directories.add(Path.of("").toAbsolutePath());

        for (Path directory : directories) {
            if (!Files.isDirectory(directory)) {
                continue;
            }
            List<Path> matches = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, CLIENT_SECRET_GLOB)) {
                stream.forEach(matches::add);
            }
            if (!matches.isEmpty()) {
                matches.sort(null);
                return Optional.of(matches.get(0));
            }
            Path credentials = directory.resolve(CREDENTIALS_FILE);
            if (Files.isRegularFile(credentials)) {
                return Optional.of(credentials);
            }
        }
        return Optional.empty();
    }

    private static GoogleTokenDTO toTokenFile(GoogleClientSecrets secrets, Credential credential) {
        GoogleTokenDTO dto = new GoogleTokenDTO();
        dto.setToken(credential.getAccessToken());
        dto.setRefreshToken(credential.getRefreshToken());
        dto.setTokenUri(secrets.getDetails().getTokenUri());
        dto.setClientId(secrets.getDetails().getClientId());
        dto.setClientSecret(secrets.getDetails().getClientSecret());
        Long expiresAt = credential.getExpirationTimeMilliseconds();
        dto.setExpiry(expiresAt != null ? Instant.ofEpochMilli(expiresAt).toString() : null);
        dto.putAdditional("scopes", List.of(DRIVE_READONLY));
        return dto;
    }
}
