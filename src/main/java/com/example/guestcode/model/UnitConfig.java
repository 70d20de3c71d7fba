package com.example.guestcode.model;

import lombok.Builder;

import java.time.LocalTime;

/**
 * One managed apartment: where its bookings live, which lock and which guest
 * code it drives. {@code provisioningPin} may be {@code null}.
 */
@Builder
public record UnitConfig(
        String unitId,
        String displayName,
        String authName,
        String bookingFileId,
        long lockId,
        Integer provisioningPin,
        LocalTime checkinTime,
        LocalTime checkoutTime
) {

    public boolean hasProvisioningPin() {
        return provisioningPin != null;
    }
}
