package com.example.guestcode.service;

import com.example.guestcode.dto.GoogleTokenDTO;
import com.example.guestcode.service.exception.BookingSourceException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.http.HttpTransportFactory;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.UserCredentials;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Drive credentials kept in the OAuth "authorized user" file. The access
 * token is refreshed through {@link UserCredentials} when it is expired or
 * about to expire, and the new token is written back to the file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleTokenStore {

    private final HttpTransportFactory googleTransportFactory;
    private final ObjectMapper objectMapper;

    @Value("${google.token-path}")
    private String tokenPath;

    public synchronized String accessToken() {
        GoogleTokenDTO stored = read();
        UserCredentials credentials = toCredentials(stored);
        try {
            credentials.refreshIfExpired();
        } catch (IOException | IllegalStateException e) {
            throw new BookingSourceException("Google token in " + tokenPath
                    + " cannot be refreshed, run with --authorize: " + e.getMessage(), e);
        }

        AccessToken current = credentials.getAccessToken();
        if (current == null) {
            throw new BookingSourceException("Google token endpoint returned no access token");
        }
        if (!current.getTokenValue().equals(stored.getToken())) {
            stored.setToken(current.getTokenValue());
            stored.setExpiry(current.getExpirationTime() != null
                    ? current.getExpirationTime().toInstant().toString() : null);
            write(stored);
            log.info("Google access token refreshed, valid until {}", stored.getExpiry());
        }
        return current.getTokenValue();
    }

    /** True if the file exists and yields an access token, refreshing it if needed. */
    public boolean isAuthorized() {
        if (!Files.exists(tokenFile())) {
            return false;
        }
        try {
            accessToken();
            return true;
        } catch (BookingSourceException e) {
            log.warn("Stored Google token is not usable: {}", e.getMessage());
            return false;
        }
    }

    public Path tokenFile() {
        return Path.of(tokenPath);
    }

    public void save(GoogleTokenDTO credentials) {
        write(credentials);
    }

    UserCredentials toCredentials(GoogleTokenDTO stored) {
        if (isBlank(stored.getClientId()) || isBlank(stored.getClientSecret())) {
            throw new BookingSourceException("Google token in " + tokenPath
                    + " has no client_id or client_secret, run with --authorize");
        }
        if (isBlank(stored.getToken()) && isBlank(stored.getRefreshToken())) {
            throw new BookingSourceException("Google token in " + tokenPath
                    + " has neither token nor refresh token, run with --authorize");
        }

        UserCredentials.Builder builder = UserCredentials.newBuilder()
                .setClientId(stored.getClientId())
                .setClientSecret(stored.getClientSecret())
                .setRefreshToken(isBlank(stored.getRefreshToken()) ? null : stored.getRefreshToken())
                .setHttpTransportFactory(googleTransportFactory);
        if (!isBlank(stored.getToken())) {
            builder.setAccessToken(new AccessToken(stored.getToken(), expiryOf(stored)));
        }
        if (!isBlank(stored.getTokenUri())) {
            builder.setTokenServerUri(URI.create(stored.getTokenUri()));
        }
        return builder.build();
    }

    private Date expiryOf(GoogleTokenDTO stored) {
        if (isBlank(stored.getExpiry())) {
            return null;
        }
        try {
            return Date.from(Instant.parse(stored.getExpiry()));
        } catch (DateTimeParseException e) {
            log.warn("Unreadable token expiry '{}', treating token as expired", stored.getExpiry());
            return new Date(0);
        }
    }

    private GoogleTokenDTO read() {
        try {
            return objectMapper.readValue(tokenFile().toFile(), GoogleTokenDTO.class);
        } catch (IOException e) {
            throw new BookingSourceException("Cannot read Google token " + tokenPath
                    + ", run with --authorize: " + e.getMessage(), e);
        }
    }

    private void write(GoogleTokenDTO credentials) {
        try {
            objectMapper.writeValue(tokenFile().toFile(), credentials);
        } catch (IOException e) {
            throw new BookingSourceException("Cannot write Google token " + tokenPath + ": " + e.getMessage(), e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
