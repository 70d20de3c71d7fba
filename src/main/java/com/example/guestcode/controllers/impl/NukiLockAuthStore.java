package com.example.guestcode.controllers.impl;

import com.example.guestcode.controllers.LockAuthStore;
import com.example.guestcode.dto.SmartlockAuthDTO;
import com.example.guestcode.model.AuthorizationEntry;
import com.example.guestcode.service.exception.LockBackendException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class NukiLockAuthStore implements LockAuthStore {

    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Value("${nuki.api.base-url}")
    private String baseUrl;

    @Override
    public List<SmartlockAuthDTO> list(long lockId) {
        String url = baseUrl + "/smartlock/" + lockId + "/auth";
        try {
            ResponseEntity<SmartlockAuthDTO[]> response = restTemplate.getForEntity(url, SmartlockAuthDTO[].class);
            SmartlockAuthDTO[] body = response.getBody();
            return body != null ? Arrays.asList(body) : Collections.emptyList();
        } catch (HttpStatusCodeException e) {
            log.error("Failed to list authorizations of lock {}: {} : {}", lockId,
                    e.getStatusCode(), e.getResponseBodyAsString());
            throw new LockBackendException("Listing codes of lock " + lockId + " failed with status "
                    + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Failed to list authorizations of lock {}: {}", lockId, e.getMessage());
            throw new LockBackendException("Listing codes of lock " + lockId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<SmartlockAuthDTO> create(long lockId, String name, int pin, int weekdayMask) {
        String url = baseUrl + "/smartlock/auth";
        var body = new AuthCreateRequest(name, AuthorizationEntry.KEYPAD_CODE, pin, List.of(lockId), weekdayMask);
        try {
            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.PUT, new HttpEntity<>(body), String.class);
            log.info("Created code '{}' on lock {} ({})", name, lockId, response.getStatusCode());
            return parseCreated(response.getBody());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                log.info("Code '{}' already exists on lock {}", name, lockId);
                return Optional.empty();
            }
            log.error("Failed to create code '{}' on lock {}: {} : {}", name, lockId,
                    e.getStatusCode(), e.getResponseBodyAsString());
            throw new LockBackendException("Creating code '" + name + "' on lock " + lockId
                    + " failed with status " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Failed to create code '{}' on lock {}: {}", name, lockId, e.getMessage());
            throw new LockBackendException("Creating code '" + name + "' on lock " + lockId + " failed: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void setWindow(long lockId, String authId, Instant start, Instant end) {
        String url = baseUrl + "/smartlock/" + lockId + "/auth/" + authId;
        Object body = start == null && end == null
                ? new WindowClearRequest(null, null)
                : new WindowUpdateRequest(format(start), format(end), ALL_WEEKDAYS);
        try {
            restTemplate.postForEntity(url, new HttpEntity<>(body), Void.class);
        } catch (HttpStatusCodeException e) {
            log.error("Failed to update window of auth {} on lock {}: {} : {}", authId, lockId,
                    e.getStatusCode(), e.getResponseBodyAsString());
            throw new LockBackendException("Updating code " + authId + " on lock " + lockId
                    + " failed with status " + e.getStatusCode(), e);
        } catch (RestClientException e) {
            log.error("Failed to update window of auth {} on lock {}: {}", authId, lockId, e.getMessage());
            throw new LockBackendException("Updating code " + authId + " on lock " + lockId + " failed: "
                    + e.getMessage(), e);
        }
    }

    @Override
    public void forceSync(long lockId) {
        String url = baseUrl + "/smartlock/" + lockId + "/sync";
        try {
            restTemplate.postForEntity(url, null, Void.class);
        } catch (RestClientException e) {
            throw new LockBackendException("Sync of lock " + lockId + " failed: " + e.getMessage(), e);
        }
    }

    private Optional<SmartlockAuthDTO> parseCreated(String body) {
        if (body == null || body.isBlank()) {
            return Optional.empty();
        }
        try {
            SmartlockAuthDTO dto = objectMapper.readValue(body, SmartlockAuthDTO.class);
            return Optional.ofNullable(dto).filter(d -> d.resolveId() != null);
        } catch (JsonProcessingException e) {
            log.debug("Create response is not an authorization, will look it up: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String format(Instant instant) {
        return instant == null ? null : TIMESTAMP.format(instant);
    }

    private record AuthCreateRequest(String name, int type, int code, List<Long> smartlockIds, int allowedWeekDays) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private record WindowUpdateRequest(String allowedFromDate, String allowedUntilDate, int allowedWeekDays) {}

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private record WindowClearRequest(String allowedFromDate, String allowedUntilDate) {}
}
