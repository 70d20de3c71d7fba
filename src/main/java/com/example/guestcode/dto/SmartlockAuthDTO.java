package com.example.guestcode.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Authorization as listed by {@code GET /smartlock/{id}/auth}. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SmartlockAuthDTO {

    private String id;

    private String authId;

    /** Older payloads spell it this way. */
    @JsonProperty("authID")
    private String legacyAuthId;

    private String name;

    private Integer type;

    private String allowedFromDate;

    private String allowedUntilDate;

    private Integer allowedWeekDays;

    public String resolveId() {
        if (id != null && !id.isBlank()) {
            return id;
        }
        if (authId != null && !authId.isBlank()) {
            return authId;
        }
        return legacyAuthId;
    }
}
