package com.example.guestcode.dto;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * OAuth "authorized user" file. Fields not modelled here are kept so the
 * file can be written back unchanged apart from the token.
 */
@Data
public class GoogleTokenDTO {

    private String token;

    @JsonProperty("refresh_token")
    private String refreshToken;

    @JsonProperty("token_uri")
    private String tokenUri;

    @JsonProperty("client_id")
    private String clientId;

    @JsonProperty("client_secret")
    private String clientSecret;

    private String expiry;

    private Map<String, Object> additional = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAdditional(String key, Object value) {
        additional.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditional() {
        return additional;
    }
}
