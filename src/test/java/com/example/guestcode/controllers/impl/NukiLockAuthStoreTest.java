package com.example.guestcode.controllers.impl;

import com.example.guestcode.dto.SmartlockAuthDTO;
import com.example.guestcode.service.exception.LockBackendException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class NukiLockAuthStoreTest {

    private static final String BASE_URL = "https://api.nuki.test";

    private MockRestServiceServer server;
    private NukiLockAuthStore store;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        store = new NukiLockAuthStore(restTemplate, new ObjectMapper());
        ReflectionTestUtils.setField(store, "baseUrl", BASE_URL);
    }

    @Test
    void shouldListAuthorizations() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/auth"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("""
                        [{"id":"a1","name":"Guests","type":13,"allowedFromDate":"2025-06-10T13:00:00.000Z",
                          "allowedUntilDate":"2025-06-12T09:00:00.000Z","allowedWeekDays":127,"enabled":true},
                         {"authID":"77","name":"Owner","type":0}]""", MediaType.APPLICATION_JSON));

        List<SmartlockAuthDTO> auths = store.list(4711);

        assertThat(auths).hasSize(2);
        assertThat(auths.get(0).resolveId()).isEqualTo("a1");
        assertThat(auths.get(0).getAllowedFromDate()).isEqualTo("2025-06-10T13:00:00.000Z");
        assertThat(auths.get(1).resolveId()).isEqualTo("77");
        server.verify();
    }

    @Test
    void shouldTreatEmptyResponseAsNoAuthorizations() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/auth"))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        assertThat(store.list(4711)).isEmpty();
    }

    @Test
    void shouldWrapServerErrors() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/auth"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        assertThatThrownBy(() -> store.list(4711))
                .isInstanceOf(LockBackendException.class)
                .hasMessageContaining("4711");
    }

    @Test
    void shouldCreateKeypadCode() {
        server.expect(requestTo(BASE_URL + "/smartlock/auth"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(content().json("""
                        {"name":"Guests","type":13,"code":123456,"smartlockIds":[4711],"allowedWeekDays":127}"""))
                .andRespond(withSuccess());

        Optional<SmartlockAuthDTO> created = store.create(4711, "Guests", 123456, 127);

        assertThat(created).isEmpty();
        server.verify();
    }

    @Test
    void shouldAcceptConflictOnCreate() {
        server.expect(requestTo(BASE_URL + "/smartlock/auth"))
                .andRespond(withStatus(HttpStatus.CONFLICT));

        assertThat(store.create(4711, "Guests", 123456, 127)).isEmpty();
    }

    @Test
    void shouldSendWindowInUtcWithMilliseconds() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/auth/a1"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("""
                        {"allowedFromDate":"2025-06-10T13:00:00.000Z",
                         "allowedUntilDate":"2025-06-12T09:00:00.000Z","allowedWeekDays":127}""", true))
                .andRespond(withSuccess());

        store.setWindow(4711, "a1", Instant.parse("2025-06-10T13:00:00Z"), Instant.parse("2025-06-12T09:00:00Z"));

        server.verify();
    }

    @Test
    void shouldSendExplicitNullsToClearWindow() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/auth/a1"))
                .andExpect(content().json("""
                        {"allowedFromDate":null,"allowedUntilDate":null}""", true))
                .andRespond(withSuccess());

        store.setWindow(4711, "a1", null, null);

        server.verify();
    }

    @Test
    void shouldRequestSync() {
        server.expect(requestTo(BASE_URL + "/smartlock/4711/sync"))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withStatus(HttpStatus.NO_CONTENT));

        store.forceSync(4711);

        server.verify();
    }
}
